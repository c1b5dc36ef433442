package info.isaksson.erland.hackoutline.pos;

import java.util.Arrays;

/**
 * Offset to line lookup for one content string.
 *
 * <p>Lines are 1-based and end at {@code '\n'}; a {@code "\r\n"} pair belongs to the line it ends.</p>
 */
public final class LineMap {

    private final int[] lineStarts;
    private final int length;

    private LineMap(int[] lineStarts, int length) {
        this.lineStarts = lineStarts;
        this.length = length;
    }

    public static LineMap of(String content) {
        String s = content == null ? "" : content;
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == '\n') {
                if (count == starts.length) starts = Arrays.copyOf(starts, count * 2);
                starts[count++] = i + 1;
            }
        }
        return new LineMap(Arrays.copyOf(starts, count), s.length());
    }

    /** 1-based line containing {@code offset}; offsets past the end map to the last line. */
    public int line(int offset) {
        int clamped = Math.max(0, Math.min(offset, length));
        int idx = Arrays.binarySearch(lineStarts, clamped);
        if (idx < 0) idx = -idx - 2;
        return idx + 1;
    }

    /** Offset of the first character of the line containing {@code offset}. */
    public int bol(int offset) {
        return lineStarts[line(offset) - 1];
    }

    public int lineCount() {
        return lineStarts.length;
    }
}

package info.isaksson.erland.hackoutline.pos;

import java.util.Objects;

/**
 * A half-open source range {@code [start, end)} in a {@link RelativePath}.
 *
 * <p>Both ends carry their line (1-based), the offset of that line's first character and the
 * absolute character offset, so the range can be rendered without the original content.</p>
 */
public final class Pos {

    public final RelativePath file;
    public final int startLine;
    public final int startBol;
    public final int startOffset;
    public final int endLine;
    public final int endBol;
    public final int endOffset;

    public Pos(RelativePath file,
               int startLine, int startBol, int startOffset,
               int endLine, int endBol, int endOffset) {
        this.file = Objects.requireNonNull(file, "file");
        this.startLine = startLine;
        this.startBol = startBol;
        this.startOffset = startOffset;
        this.endLine = endLine;
        this.endBol = endBol;
        this.endOffset = endOffset;
    }

    public static Pos of(RelativePath file, LineMap lines, int start, int end) {
        return new Pos(file,
                lines.line(start), lines.bol(start), start,
                lines.line(end), lines.bol(end), end);
    }

    /**
     * The smallest range from the start of {@code first} to the end of {@code last}.
     *
     * @throws IllegalArgumentException if the positions are in different files or {@code last} ends
     *                                  before {@code first} starts
     */
    public static Pos btw(Pos first, Pos last) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(last, "last");
        if (!first.file.equals(last.file)) {
            throw new IllegalArgumentException("Pos.btw: positions from different files: " + first.file + " vs " + last.file);
        }
        if (last.endOffset < first.startOffset) {
            throw new IllegalArgumentException("Pos.btw: invalid positions " + first + " and " + last);
        }
        return new Pos(first.file,
                first.startLine, first.startBol, first.startOffset,
                last.endLine, last.endBol, last.endOffset);
    }

    /** True if {@code other} lies inside this range (same file, inclusive bounds). */
    public boolean contains(Pos other) {
        return other != null
                && file.equals(other.file)
                && startOffset <= other.startOffset
                && other.endOffset <= endOffset;
    }

    public AbsolutePos toAbsolute() {
        return new AbsolutePos(file.toAbsolute(),
                startLine, startBol, startOffset,
                endLine, endBol, endOffset);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Pos)) return false;
        Pos that = (Pos) o;
        return startOffset == that.startOffset
                && endOffset == that.endOffset
                && startLine == that.startLine
                && endLine == that.endLine
                && startBol == that.startBol
                && endBol == that.endBol
                && file.equals(that.file);
    }

    @Override public int hashCode() {
        return Objects.hash(file, startOffset, endOffset);
    }

    @Override public String toString() {
        return file + ":" + startLine + ":" + (startOffset - startBol + 1) + "-" + endLine + ":" + (endOffset - endBol);
    }
}

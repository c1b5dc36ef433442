package info.isaksson.erland.hackoutline.pos;

import java.util.Objects;

/**
 * A {@link Pos} whose file has been resolved to a plain file name.
 *
 * <p>Columns are 1-based. The end column is inclusive, so a zero-width position reports
 * {@code charEnd == charStart - 1}.</p>
 */
public final class AbsolutePos {

    public final String file;
    public final int startLine;
    public final int startBol;
    public final int startOffset;
    public final int endLine;
    public final int endBol;
    public final int endOffset;

    /** Single-line view of a position: the start line and the column range. */
    public record LineInfo(int line, int charStart, int charEnd) {}

    /** Multi-line view of a range. */
    public record MultilineInfo(int lineStart, int charStart, int lineEnd, int charEnd) {}

    public AbsolutePos(String file,
                       int startLine, int startBol, int startOffset,
                       int endLine, int endBol, int endOffset) {
        this.file = Objects.requireNonNullElse(file, "");
        this.startLine = startLine;
        this.startBol = startBol;
        this.startOffset = startOffset;
        this.endLine = endLine;
        this.endBol = endBol;
        this.endOffset = endOffset;
    }

    /**
     * Line and column range. The end column is measured from the start line, so for a range that
     * spans lines it can exceed the start line's length.
     */
    public LineInfo lineInfo() {
        return new LineInfo(startLine, startOffset - startBol + 1, endOffset - startBol);
    }

    public MultilineInfo multilineInfo() {
        return new MultilineInfo(startLine, startOffset - startBol + 1, endLine, endOffset - endBol);
    }

    /** {@code File "a.php", line 3, characters 7-9:} */
    public String describe() {
        LineInfo i = lineInfo();
        return "File \"" + file + "\", line " + i.line() + ", characters " + i.charStart() + "-" + i.charEnd() + ":";
    }

    /** {@code File "a.php", line 3, character 1 - line 5, character 1:} */
    public String describeMultiline() {
        MultilineInfo i = multilineInfo();
        return "File \"" + file + "\", line " + i.lineStart() + ", character " + i.charStart()
                + " - line " + i.lineEnd() + ", character " + i.charEnd() + ":";
    }

    public boolean contains(AbsolutePos other) {
        return other != null
                && file.equals(other.file)
                && startOffset <= other.startOffset
                && other.endOffset <= endOffset;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AbsolutePos)) return false;
        AbsolutePos that = (AbsolutePos) o;
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
        return describeMultiline();
    }
}

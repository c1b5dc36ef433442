package info.isaksson.erland.hackoutline.pos;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class PosTest {

    private static final String CONTENT = "<?hh\nclass Foo {\n  function bar() {}\n}\n";

    @Test
    void lineMapFindsLinesAndLineStarts() {
        LineMap lines = LineMap.of(CONTENT);
        assertEquals(5, lines.lineCount());
        assertEquals(1, lines.line(0));
        assertEquals(1, lines.line(4));   // the '\n' belongs to line 1
        assertEquals(2, lines.line(5));
        assertEquals(5, lines.bol(11));
        assertEquals(3, lines.line(CONTENT.indexOf("bar")));
        assertEquals(5, lines.line(CONTENT.length()));
        assertEquals(5, lines.line(CONTENT.length() + 10));
    }

    @Test
    void lineInfoIsOneBasedWithInclusiveEnd() {
        LineMap lines = LineMap.of(CONTENT);
        int start = CONTENT.indexOf("Foo");
        AbsolutePos pos = Pos.of(RelativePath.named("a.php"), lines, start, start + 3).toAbsolute();

        AbsolutePos.LineInfo info = pos.lineInfo();
        assertEquals(2, info.line());
        assertEquals(7, info.charStart());
        assertEquals(9, info.charEnd());
        assertEquals("File \"a.php\", line 2, characters 7-9:", pos.describe());
    }

    @Test
    void columnsCountUtf16CodeUnitsOnNonAsciiLines() {
        // e-acute is one code unit, the emoji a surrogate pair.
        String content = "<?hh\n/*\u00e9\uD83D\uDE00*/class Foo {}\n";
        LineMap lines = LineMap.of(content);
        int start = content.indexOf("Foo");
        AbsolutePos pos = Pos.of(RelativePath.named("u.php"), lines, start, start + 3).toAbsolute();

        assertEquals(new AbsolutePos.LineInfo(2, 14, 16), pos.lineInfo());
        assertEquals("File \"u.php\", line 2, characters 14-16:", pos.describe());
    }

    @Test
    void zeroWidthPositionEndsBeforeItStarts() {
        LineMap lines = LineMap.of(CONTENT);
        AbsolutePos pos = Pos.of(RelativePath.DEFAULT, lines, 7, 7).toAbsolute();
        assertEquals(3, pos.lineInfo().charStart());
        assertEquals(2, pos.lineInfo().charEnd());
    }

    @Test
    void multilineInfoMeasuresEndFromItsOwnLine() {
        LineMap lines = LineMap.of(CONTENT);
        int start = CONTENT.indexOf("class");
        int end = CONTENT.lastIndexOf('}') + 1;
        AbsolutePos span = Pos.of(RelativePath.named("a.php"), lines, start, end).toAbsolute();

        assertEquals(new AbsolutePos.MultilineInfo(2, 1, 4, 1), span.multilineInfo());
        assertEquals("File \"a.php\", line 2, character 1 - line 4, character 1:", span.describeMultiline());
        // Single-line view keeps counting from the start line.
        assertEquals(end - 5, span.lineInfo().charEnd());
    }

    @Test
    void btwCoversBothPositions() {
        LineMap lines = LineMap.of(CONTENT);
        RelativePath file = RelativePath.named("a.php");
        Pos name = Pos.of(file, lines, 11, 14);
        Pos body = Pos.of(file, lines, 15, 38);

        Pos both = Pos.btw(name, body);
        assertEquals(11, both.startOffset);
        assertEquals(38, both.endOffset);
        assertTrue(both.contains(name));
        assertTrue(both.contains(body));
        assertFalse(name.contains(both));
    }

    @Test
    void btwRejectsDifferentFilesAndReversedRanges() {
        LineMap lines = LineMap.of(CONTENT);
        Pos a = Pos.of(RelativePath.named("a.php"), lines, 11, 14);
        Pos b = Pos.of(RelativePath.named("b.php"), lines, 15, 20);
        Pos early = Pos.of(RelativePath.named("a.php"), lines, 0, 4);

        assertThrows(IllegalArgumentException.class, () -> Pos.btw(a, b));
        assertThrows(IllegalArgumentException.class, () -> Pos.btw(a, early));
        assertThrows(NullPointerException.class, () -> Pos.btw(a, null));
    }

    @Test
    void relativePathResolvesAgainstItsBase() {
        assertEquals("", RelativePath.DEFAULT.toAbsolute());
        assertEquals("src/a.php", RelativePath.named("src/a.php").toAbsolute());
        assertEquals(Path.of("root").resolve("lib/a.php").toString(),
                RelativePath.of(Path.of("root"), "lib/a.php").toAbsolute());
        assertEquals(RelativePath.named("x"), RelativePath.named("x"));
        assertNotEquals(RelativePath.named("x"), RelativePath.of(Path.of("r"), "x"));
    }
}

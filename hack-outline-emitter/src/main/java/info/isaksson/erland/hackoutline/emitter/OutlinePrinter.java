package info.isaksson.erland.hackoutline.emitter;

import info.isaksson.erland.hackoutline.model.Def;
import info.isaksson.erland.hackoutline.model.Modifier;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Indented text dump of an outline, for debugging.
 *
 * <pre>
 * Foo
 *   kind: class
 *   position: File "a.php", line 3, characters 7-9:
 *   span: File "a.php", line 3, character 1 - line 5, character 1:
 *   modifiers: final
 *
 *   bar
 *     kind: method
 *     ...
 * </pre>
 */
public final class OutlinePrinter {

    private static final String INDENT = "  ";

    private OutlinePrinter() {}

    public static void print(List<Def> outline, PrintStream out) {
        try {
            print(outline, (Appendable) out);
        } catch (IOException e) {
            // PrintStream does not throw
            throw new UncheckedIOException(e);
        }
        out.flush();
    }

    public static void print(List<Def> outline, Appendable out) throws IOException {
        for (Def def : outline) {
            print(def, "", out);
        }
    }

    public static String toText(List<Def> outline) {
        StringBuilder sb = new StringBuilder();
        try {
            print(outline, sb);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return sb.toString();
    }

    private static void print(Def def, String indent, Appendable out) throws IOException {
        out.append(indent).append(def.name).append('\n');
        out.append(indent).append(INDENT).append("kind: ").append(def.kind.label).append('\n');
        out.append(indent).append(INDENT).append("position: ").append(def.pos.describe()).append('\n');
        out.append(indent).append(INDENT).append("span: ").append(def.span.describeMultiline()).append('\n');
        out.append(indent).append(INDENT).append("modifiers: ");
        for (Modifier m : def.modifiers) {
            out.append(m.label).append(' ');
        }
        out.append("\n\n");
        for (Def child : def.children) {
            print(child, indent + INDENT, out);
        }
    }
}

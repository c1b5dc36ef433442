package info.isaksson.erland.hackoutline.extract;

import info.isaksson.erland.hackoutline.ast.FunKind;
import info.isaksson.erland.hackoutline.ast.Kind;
import info.isaksson.erland.hackoutline.model.Modifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps modifier keywords to canonical {@link Modifier}s.
 *
 * <p>Keyword order is preserved. {@link Modifier#ASYNC} never comes from a keyword; it is derived from
 * the {@link FunKind} and goes after the keyword modifiers.</p>
 */
public final class ModifierNormalizer {

    private ModifierNormalizer() {}

    public static Modifier of(Kind kind) {
        Objects.requireNonNull(kind, "kind");
        return switch (kind) {
            case FINAL -> Modifier.FINAL;
            case STATIC -> Modifier.STATIC;
            case ABSTRACT -> Modifier.ABSTRACT;
            case PRIVATE -> Modifier.PRIVATE;
            case PUBLIC -> Modifier.PUBLIC;
            case PROTECTED -> Modifier.PROTECTED;
        };
    }

    public static List<Modifier> normalize(List<Kind> kinds) {
        List<Modifier> out = new ArrayList<>(kinds.size() + 1);
        for (Kind k : kinds) {
            out.add(of(k));
        }
        return out;
    }

    /** Keyword modifiers followed by {@code async} when the function kind is async. */
    public static List<Modifier> forFunction(List<Kind> kinds, FunKind funKind) {
        List<Modifier> out = normalize(kinds);
        if (funKind.isAsync()) out.add(Modifier.ASYNC);
        return out;
    }
}

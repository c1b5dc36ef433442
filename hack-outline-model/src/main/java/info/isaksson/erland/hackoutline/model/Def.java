package info.isaksson.erland.hackoutline.model;

import info.isaksson.erland.hackoutline.pos.AbsolutePos;

import java.util.List;
import java.util.Objects;

/**
 * One entry of a file outline.
 *
 * <p>Immutable. {@code pos} is the anchor (usually the name) and lies within {@code span}, which
 * covers the whole declaration. Only container kinds ({@link DefKind#isContainer()}) carry
 * children; for every other kind the list is empty.</p>
 */
public final class Def {
    public final DefKind kind;
    public final String name;
    public final AbsolutePos pos;
    public final AbsolutePos span;
    /** Source order, duplicates kept. */
    public final List<Modifier> modifiers;
    public final List<Def> children;

    public Def(DefKind kind,
               String name,
               AbsolutePos pos,
               AbsolutePos span,
               List<Modifier> modifiers,
               List<Def> children) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = Objects.requireNonNullElse(name, "");
        this.pos = Objects.requireNonNull(pos, "pos");
        this.span = Objects.requireNonNull(span, "span");
        this.modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
        this.children = children == null ? List.of() : List.copyOf(children);
        if (!kind.isContainer() && !this.children.isEmpty()) {
            throw new IllegalArgumentException(kind.label + " '" + this.name + "' cannot have children");
        }
    }

    /** A member or function entry without children. */
    public static Def leaf(DefKind kind, String name, AbsolutePos pos, AbsolutePos span, List<Modifier> modifiers) {
        return new Def(kind, name, pos, span, modifiers, List.of());
    }

    public boolean hasModifier(Modifier modifier) {
        return modifiers.contains(modifier);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Def)) return false;
        Def that = (Def) o;
        return kind == that.kind
                && name.equals(that.name)
                && pos.equals(that.pos)
                && span.equals(that.span)
                && modifiers.equals(that.modifiers)
                && children.equals(that.children);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, name, pos, span, modifiers, children);
    }

    @Override public String toString() {
        return kind.label + " " + name + " " + modifiers + (children.isEmpty() ? "" : " " + children);
    }
}

package info.isaksson.erland.hackoutline.ast;

import info.isaksson.erland.hackoutline.pos.Pos;

import java.util.List;
import java.util.Objects;

public final class Method implements ClassElement {
    /** Modifier keywords in source order ({@code async} is carried by {@link #funKind}). */
    public final List<Kind> kinds;
    public final Id name;
    public final Pos span;
    public final FunKind funKind;

    public Method(List<Kind> kinds, Id name, Pos span, FunKind funKind) {
        this.kinds = kinds == null ? List.of() : List.copyOf(kinds);
        this.name = Objects.requireNonNull(name, "name");
        this.span = Objects.requireNonNull(span, "span");
        this.funKind = funKind == null ? FunKind.SYNC : funKind;
    }

    @Override public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMethod(this);
    }
}

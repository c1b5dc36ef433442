package info.isaksson.erland.hackoutline.ast;

import info.isaksson.erland.hackoutline.pos.Pos;

import java.util.Objects;

/** A top-level {@code function}. The name is namespace-qualified with a leading backslash. */
public final class FunDef implements Definition {
    public final Id name;
    public final Pos span;
    public final FunKind funKind;

    public FunDef(Id name, Pos span, FunKind funKind) {
        this.name = Objects.requireNonNull(name, "name");
        this.span = Objects.requireNonNull(span, "span");
        this.funKind = funKind == null ? FunKind.SYNC : funKind;
    }

    @Override public Pos span() {
        return span;
    }

    @Override public <R> R accept(Visitor<R> visitor) {
        return visitor.visitFun(this);
    }
}

package info.isaksson.erland.hackoutline.ast;

import info.isaksson.erland.hackoutline.pos.Pos;

import java.util.Objects;

/** {@code [abstract] const type T [as C] [= int];} */
public final class TypeConst implements ClassElement {
    public final Id name;
    public final Pos span;
    public final boolean isAbstract;

    public TypeConst(Id name, Pos span, boolean isAbstract) {
        this.name = Objects.requireNonNull(name, "name");
        this.span = Objects.requireNonNull(span, "span");
        this.isAbstract = isAbstract;
    }

    @Override public <R> R accept(Visitor<R> visitor) {
        return visitor.visitTypeConst(this);
    }
}

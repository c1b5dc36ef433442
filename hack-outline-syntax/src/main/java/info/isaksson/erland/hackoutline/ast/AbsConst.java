package info.isaksson.erland.hackoutline.ast;

import java.util.Objects;

/** {@code abstract const int X;} */
public final class AbsConst implements ClassElement {
    public final Id name;

    public AbsConst(Id name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override public <R> R accept(Visitor<R> visitor) {
        return visitor.visitAbsConst(this);
    }
}

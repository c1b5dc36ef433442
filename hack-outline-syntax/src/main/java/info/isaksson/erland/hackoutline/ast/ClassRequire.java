package info.isaksson.erland.hackoutline.ast;

import java.util.Objects;

/** {@code require extends X;} or {@code require implements Y;} */
public final class ClassRequire implements ClassElement {
    public final boolean isExtends;
    public final Id name;

    public ClassRequire(boolean isExtends, Id name) {
        this.isExtends = isExtends;
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override public <R> R accept(Visitor<R> visitor) {
        return visitor.visitClassRequire(this);
    }
}

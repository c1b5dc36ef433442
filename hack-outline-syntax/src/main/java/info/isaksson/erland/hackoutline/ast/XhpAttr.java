package info.isaksson.erland.hackoutline.ast;

import java.util.Objects;

/** An XHP {@code attribute} declaration. The variable name keeps the leading {@code :}. */
public final class XhpAttr implements ClassElement {
    public final ClassVar var;
    public final boolean required;

    public XhpAttr(ClassVar var, boolean required) {
        this.var = Objects.requireNonNull(var, "var");
        this.required = required;
    }

    @Override public <R> R accept(Visitor<R> visitor) {
        return visitor.visitXhpAttr(this);
    }
}

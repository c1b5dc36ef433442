package info.isaksson.erland.hackoutline.ast;

import java.util.List;

/** XHP {@code category %flow, %phrase;} */
public final class XhpCategory implements ClassElement {
    public final List<Id> names;

    public XhpCategory(List<Id> names) {
        this.names = names == null ? List.of() : List.copyOf(names);
    }

    @Override public <R> R accept(Visitor<R> visitor) {
        return visitor.visitXhpCategory(this);
    }
}

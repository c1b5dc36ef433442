package info.isaksson.erland.hackoutline.ast;

import info.isaksson.erland.hackoutline.pos.Pos;

import java.util.Objects;

/** XHP {@code children ...;} declaration; the content model itself is not parsed. */
public final class XhpChildren implements ClassElement {
    public final Pos span;

    public XhpChildren(Pos span) {
        this.span = Objects.requireNonNull(span, "span");
    }

    @Override public <R> R accept(Visitor<R> visitor) {
        return visitor.visitXhpChildren(this);
    }
}

package info.isaksson.erland.hackoutline.ast;

import info.isaksson.erland.hackoutline.pos.Pos;

import java.util.Objects;

/** {@code type} or {@code newtype} alias. */
public final class Typedef implements Definition {
    public final Id name;
    public final Pos span;

    public Typedef(Id name, Pos span) {
        this.name = Objects.requireNonNull(name, "name");
        this.span = Objects.requireNonNull(span, "span");
    }

    @Override public Pos span() {
        return span;
    }

    @Override public <R> R accept(Visitor<R> visitor) {
        return visitor.visitTypedef(this);
    }
}

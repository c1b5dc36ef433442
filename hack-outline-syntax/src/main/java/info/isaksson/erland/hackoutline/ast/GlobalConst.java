package info.isaksson.erland.hackoutline.ast;

import info.isaksson.erland.hackoutline.pos.Pos;

import java.util.Objects;

/** A top-level {@code const} declaration. */
public final class GlobalConst implements Definition {
    public final Pos span;

    public GlobalConst(Pos span) {
        this.span = Objects.requireNonNull(span, "span");
    }

    @Override public Pos span() {
        return span;
    }

    @Override public <R> R accept(Visitor<R> visitor) {
        return visitor.visitGlobalConst(this);
    }
}

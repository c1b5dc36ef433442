package info.isaksson.erland.hackoutline.ast;

import info.isaksson.erland.hackoutline.pos.Pos;

import java.util.Objects;

/** Any other top-level construct (statements, {@code use} imports, closures). */
public final class Stmt implements Definition {
    public final Pos span;

    public Stmt(Pos span) {
        this.span = Objects.requireNonNull(span, "span");
    }

    @Override public Pos span() {
        return span;
    }

    @Override public <R> R accept(Visitor<R> visitor) {
        return visitor.visitStmt(this);
    }
}

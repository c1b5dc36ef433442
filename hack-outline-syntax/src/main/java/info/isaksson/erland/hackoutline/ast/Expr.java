package info.isaksson.erland.hackoutline.ast;

import info.isaksson.erland.hackoutline.pos.Pos;

import java.util.Objects;

/**
 * An initializer expression. Only its extent is recorded; the parser does not interpret expressions.
 */
public final class Expr {
    public final Pos pos;

    public Expr(Pos pos) {
        this.pos = Objects.requireNonNull(pos, "pos");
    }
}

package info.isaksson.erland.hackoutline.ast;

import info.isaksson.erland.hackoutline.pos.Pos;

import java.util.Objects;

/** One variable of a property group, without the leading {@code $}. */
public final class ClassVar {
    public final Pos span;
    public final Id name;
    /** Null when the variable has no initializer. */
    public final Expr initializer;

    public ClassVar(Pos span, Id name, Expr initializer) {
        this.span = Objects.requireNonNull(span, "span");
        this.name = Objects.requireNonNull(name, "name");
        this.initializer = initializer;
    }
}

package info.isaksson.erland.hackoutline.ast;

import info.isaksson.erland.hackoutline.pos.Pos;

import java.util.Objects;

/** A name together with the location it was written at. */
public final class Id {
    public final Pos pos;
    public final String name;

    public Id(Pos pos, String name) {
        this.pos = Objects.requireNonNull(pos, "pos");
        this.name = Objects.requireNonNullElse(name, "");
    }

    @Override public String toString() {
        return name;
    }
}

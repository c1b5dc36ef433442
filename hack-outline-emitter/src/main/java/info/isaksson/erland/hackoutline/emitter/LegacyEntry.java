package info.isaksson.erland.hackoutline.emitter;

import info.isaksson.erland.hackoutline.pos.AbsolutePos;

import java.util.Objects;

/**
 * One row of the legacy flat outline: where a declaration is, its qualified name and its type
 * label ({@code "function"}, {@code "class"}, {@code "method"} or {@code "static method"}).
 */
public final class LegacyEntry {
    public final AbsolutePos pos;
    public final String name;
    public final String type;

    public LegacyEntry(AbsolutePos pos, String name, String type) {
        this.pos = Objects.requireNonNull(pos, "pos");
        this.name = Objects.requireNonNullElse(name, "");
        this.type = Objects.requireNonNull(type, "type");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LegacyEntry)) return false;
        LegacyEntry that = (LegacyEntry) o;
        return pos.equals(that.pos) && name.equals(that.name) && type.equals(that.type);
    }

    @Override public int hashCode() {
        return Objects.hash(pos, name, type);
    }

    @Override public String toString() {
        return type + " " + name + " @ " + pos.describe();
    }
}

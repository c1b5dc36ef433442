package info.isaksson.erland.hackoutline.pos;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A source file name as the parser sees it: an optional base directory plus a suffix.
 *
 * <p>{@link #DEFAULT} has no base and an empty suffix; it is used for content that did not come
 * from a file (editor buffers, stdin) and resolves to the empty file name.</p>
 */
public final class RelativePath {

    public static final RelativePath DEFAULT = new RelativePath(null, "");

    /** Base directory, or null when the suffix is used as-is. */
    public final Path base;
    public final String suffix;

    private RelativePath(Path base, String suffix) {
        this.base = base;
        this.suffix = Objects.requireNonNullElse(suffix, "");
    }

    /** A path resolved against {@code base} (e.g. a scanned source root). */
    public static RelativePath of(Path base, String suffix) {
        Objects.requireNonNull(base, "base");
        return new RelativePath(base, suffix);
    }

    /** A path whose absolute form is the given name, unchanged. */
    public static RelativePath named(String name) {
        return new RelativePath(null, name);
    }

    public String toAbsolute() {
        if (base == null) return suffix;
        return base.resolve(suffix).toString();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RelativePath)) return false;
        RelativePath that = (RelativePath) o;
        return Objects.equals(base, that.base) && suffix.equals(that.suffix);
    }

    @Override public int hashCode() {
        return Objects.hash(base, suffix);
    }

    @Override public String toString() {
        return base == null ? suffix : base + "|" + suffix;
    }
}

package info.isaksson.erland.hackoutline.parse;

import info.isaksson.erland.hackoutline.pos.Pos;

import java.util.Objects;

/** A non-fatal problem found while parsing. The parser recovers and keeps going. */
public final class SyntaxError {

    /** Error code stable across versions, e.g. {@code unexpected-token}. */
    public final String code;

    /** Human-readable message. */
    public final String message;

    public final Pos pos;

    public SyntaxError(String code, String message, Pos pos) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.pos = Objects.requireNonNull(pos, "pos must not be null");
    }

    @Override public String toString() {
        return pos.toAbsolute().describe() + " [" + code + "] " + message;
    }
}

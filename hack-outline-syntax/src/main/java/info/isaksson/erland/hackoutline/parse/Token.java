package info.isaksson.erland.hackoutline.parse;

import java.util.Objects;

/** A lexed token covering {@code [start, end)} of the content. */
public final class Token {
    public final TokenType type;
    public final String text;
    public final int start;
    public final int end;

    public Token(TokenType type, String text, int start, int end) {
        this.type = Objects.requireNonNull(type, "type");
        this.text = Objects.requireNonNullElse(text, "");
        this.start = start;
        this.end = end;
    }

    public boolean isName() {
        return type == TokenType.IDENTIFIER || type == TokenType.QUALIFIED_NAME;
    }

    /** Case-insensitive keyword match; keywords are never qualified names. */
    public boolean isKeyword(String keyword) {
        return type == TokenType.IDENTIFIER && text.equalsIgnoreCase(keyword);
    }

    public boolean isPunct(String punct) {
        return type == TokenType.PUNCT && text.equals(punct);
    }

    @Override public String toString() {
        return type + "(" + text + ")@" + start;
    }
}

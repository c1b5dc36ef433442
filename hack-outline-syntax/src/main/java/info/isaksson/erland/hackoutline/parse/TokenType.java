package info.isaksson.erland.hackoutline.parse;

public enum TokenType {
    /** A bare name. Keywords are identifiers; the parser recognises them by text. */
    IDENTIFIER,
    /** A name containing a backslash, e.g. {@code \Foo\Bar} or {@code Foo\bar}. */
    QUALIFIED_NAME,
    /** {@code $name} */
    VARIABLE,
    NUMBER,
    STRING,
    PUNCT,
    EOF
}

package info.isaksson.erland.hackoutline.ast;

/** Member modifier keywords as written in source. */
public enum Kind {
    FINAL,
    STATIC,
    ABSTRACT,
    PRIVATE,
    PUBLIC,
    PROTECTED
}

package info.isaksson.erland.hackoutline.ast;

/** The source form of a class-like declaration. */
public enum ClassKind {
    NORMAL,
    /** {@code abstract class}. */
    ABSTRACT,
    INTERFACE,
    TRAIT,
    ENUM
}

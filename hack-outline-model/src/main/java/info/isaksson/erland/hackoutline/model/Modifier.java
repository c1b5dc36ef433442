package info.isaksson.erland.hackoutline.model;

/** Canonical declaration modifier. The label is the wire name used by every renderer. */
public enum Modifier {
    FINAL("final"),
    STATIC("static"),
    ABSTRACT("abstract"),
    PRIVATE("private"),
    PUBLIC("public"),
    PROTECTED("protected"),
    ASYNC("async");

    public final String label;

    Modifier(String label) {
        this.label = label;
    }
}

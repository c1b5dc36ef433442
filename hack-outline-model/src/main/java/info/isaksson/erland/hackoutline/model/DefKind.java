package info.isaksson.erland.hackoutline.model;

/**
 * Kind of an outline entry. The label is the wire name used by every renderer.
 */
public enum DefKind {
    FUNCTION("function"),
    CLASS("class"),
    METHOD("method"),
    PROPERTY("property"),
    CONST("const"),
    ENUM("enum"),
    INTERFACE("interface"),
    TRAIT("trait"),
    TYPECONST("typeconst");

    public final String label;

    DefKind(String label) {
        this.label = label;
    }

    /** Kinds that may have member children. */
    public boolean isContainer() {
        return switch (this) {
            case CLASS, ENUM, INTERFACE, TRAIT -> true;
            case FUNCTION, METHOD, PROPERTY, CONST, TYPECONST -> false;
        };
    }
}

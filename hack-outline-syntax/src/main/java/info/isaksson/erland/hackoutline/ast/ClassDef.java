package info.isaksson.erland.hackoutline.ast;

import info.isaksson.erland.hackoutline.pos.Pos;

import java.util.List;
import java.util.Objects;

/** A class, interface, trait or enum. The name is namespace-qualified with a leading backslash. */
public final class ClassDef implements Definition {
    public final Id name;
    public final Pos span;
    public final ClassKind classKind;
    public final boolean isFinal;
    public final List<ClassElement> body;

    public ClassDef(Id name, Pos span, ClassKind classKind, boolean isFinal, List<ClassElement> body) {
        this.name = Objects.requireNonNull(name, "name");
        this.span = Objects.requireNonNull(span, "span");
        this.classKind = classKind == null ? ClassKind.NORMAL : classKind;
        this.isFinal = isFinal;
        this.body = body == null ? List.of() : List.copyOf(body);
    }

    @Override public Pos span() {
        return span;
    }

    @Override public <R> R accept(Visitor<R> visitor) {
        return visitor.visitClass(this);
    }
}

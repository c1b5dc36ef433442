package info.isaksson.erland.hackoutline.ast;

import java.util.Objects;

/** {@code use SomeTrait;} inside a class body, one element per trait named. */
public final class TraitUse implements ClassElement {
    public final Id name;

    public TraitUse(Id name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override public <R> R accept(Visitor<R> visitor) {
        return visitor.visitTraitUse(this);
    }
}

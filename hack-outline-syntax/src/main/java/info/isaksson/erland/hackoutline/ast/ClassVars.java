package info.isaksson.erland.hackoutline.ast;

import java.util.List;

/** A property group: one modifier list shared by several variables. */
public final class ClassVars implements ClassElement {
    public final List<Kind> kinds;
    public final List<ClassVar> vars;

    public ClassVars(List<Kind> kinds, List<ClassVar> vars) {
        this.kinds = kinds == null ? List.of() : List.copyOf(kinds);
        this.vars = vars == null ? List.of() : List.copyOf(vars);
    }

    @Override public <R> R accept(Visitor<R> visitor) {
        return visitor.visitClassVars(this);
    }
}

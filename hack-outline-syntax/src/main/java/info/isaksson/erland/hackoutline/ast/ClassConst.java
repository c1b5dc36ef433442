package info.isaksson.erland.hackoutline.ast;

import java.util.List;
import java.util.Objects;

/** A constant group ({@code const A = 1, B = 2;}) or an enum entry. */
public final class ClassConst implements ClassElement {

    public static final class Entry {
        public final Id name;
        public final Expr value;

        public Entry(Id name, Expr value) {
            this.name = Objects.requireNonNull(name, "name");
            this.value = Objects.requireNonNull(value, "value");
        }
    }

    public final List<Entry> entries;

    public ClassConst(List<Entry> entries) {
        this.entries = entries == null ? List.of() : List.copyOf(entries);
    }

    @Override public <R> R accept(Visitor<R> visitor) {
        return visitor.visitConst(this);
    }
}

package info.isaksson.erland.hackoutline.ast;

import java.util.List;

/** Top-level definitions of one file, namespaces flattened, in source order. */
public final class Program {
    public final List<Definition> definitions;

    public Program(List<Definition> definitions) {
        this.definitions = definitions == null ? List.of() : List.copyOf(definitions);
    }
}

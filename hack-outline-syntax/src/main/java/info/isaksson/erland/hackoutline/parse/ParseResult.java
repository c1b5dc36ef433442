package info.isaksson.erland.hackoutline.parse;

import info.isaksson.erland.hackoutline.ast.Program;

import java.util.List;
import java.util.Objects;

/** A (possibly partial) program plus the diagnostics raised while producing it. */
public final class ParseResult {
    public final Program program;
    public final List<SyntaxError> errors;

    public ParseResult(Program program, List<SyntaxError> errors) {
        this.program = Objects.requireNonNull(program, "program");
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}

package info.isaksson.erland.hackoutline.extract;

import info.isaksson.erland.hackoutline.ast.ClassDef;
import info.isaksson.erland.hackoutline.ast.Definition;
import info.isaksson.erland.hackoutline.ast.FunDef;
import info.isaksson.erland.hackoutline.ast.GlobalConst;
import info.isaksson.erland.hackoutline.ast.Program;
import info.isaksson.erland.hackoutline.ast.Stmt;
import info.isaksson.erland.hackoutline.ast.Typedef;
import info.isaksson.erland.hackoutline.model.Def;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds the outline of a whole program: one entry per top-level function or class-like, in
 * source order. Type aliases, top-level constants and statements are not part of an outline.
 */
public final class OutlineBuilder {

    private static final Logger log = LogManager.getLogger(OutlineBuilder.class);

    private static final TopLevelSummarizer TOP_LEVEL = new TopLevelSummarizer();

    private OutlineBuilder() {}

    public static List<Def> build(Program program) {
        Objects.requireNonNull(program, "program");
        List<Def> out = new ArrayList<>();
        int omitted = 0;
        for (Definition d : program.definitions) {
            Optional<Def> def = d.accept(TOP_LEVEL);
            if (def.isPresent()) {
                out.add(def.get());
            } else {
                omitted++;
            }
        }
        log.debug("Outline built: {} top-level entries, {} definitions omitted", out.size(), omitted);
        return out;
    }

    private static final class TopLevelSummarizer implements Definition.Visitor<Optional<Def>> {

        @Override public Optional<Def> visitFun(FunDef fun) {
            return Optional.of(DeclarationSummarizer.summarizeFun(fun));
        }

        @Override public Optional<Def> visitClass(ClassDef cls) {
            return Optional.of(DeclarationSummarizer.summarizeClass(cls));
        }

        // Not part of an outline.

        @Override public Optional<Def> visitTypedef(Typedef typedef) {
            return Optional.empty();
        }

        @Override public Optional<Def> visitGlobalConst(GlobalConst constant) {
            return Optional.empty();
        }

        @Override public Optional<Def> visitStmt(Stmt stmt) {
            return Optional.empty();
        }
    }
}

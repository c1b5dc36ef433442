package info.isaksson.erland.hackoutline.extract;

import info.isaksson.erland.hackoutline.ast.Program;
import info.isaksson.erland.hackoutline.model.Def;
import info.isaksson.erland.hackoutline.pos.RelativePath;

import java.util.List;

/**
 * Source text to outline: best-effort parse, then {@link OutlineBuilder}.
 *
 * <p>Never fails on malformed input; a file that does not parse yields whatever declarations
 * were recognised, possibly none.</p>
 */
public final class OutlineExtractor {

    public List<Def> extract(String content) {
        return extract(RelativePath.DEFAULT, content);
    }

    public List<Def> extract(RelativePath file, String content) {
        Program program = BestEffortParser.parse(file, content);
        return OutlineBuilder.build(program);
    }
}

package info.isaksson.erland.hackoutline.extract;

import info.isaksson.erland.hackoutline.ast.Program;
import info.isaksson.erland.hackoutline.parse.HackParser;
import info.isaksson.erland.hackoutline.parse.ParseResult;
import info.isaksson.erland.hackoutline.pos.RelativePath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Parses content and drops the diagnostics, so an outline can still be produced for a file with
 * syntax errors. This is the only place parse errors are discarded.
 */
public final class BestEffortParser {

    private static final Logger log = LogManager.getLogger(BestEffortParser.class);

    private BestEffortParser() {}

    public static Program parse(RelativePath file, String content) {
        ParseResult result = HackParser.parse(file, content);
        if (result.hasErrors()) {
            log.debug("Ignoring {} syntax error(s) in {}; first: {}", result.errors.size(), file, result.errors.get(0));
        }
        return result.program;
    }
}

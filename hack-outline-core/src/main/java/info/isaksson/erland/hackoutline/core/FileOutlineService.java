package info.isaksson.erland.hackoutline.core;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import info.isaksson.erland.hackoutline.emitter.LegacyEntry;
import info.isaksson.erland.hackoutline.emitter.LegacyFlattener;
import info.isaksson.erland.hackoutline.emitter.LegacyOutlineJson;
import info.isaksson.erland.hackoutline.emitter.OutlineJson;
import info.isaksson.erland.hackoutline.emitter.OutlinePrinter;
import info.isaksson.erland.hackoutline.extract.OutlineExtractor;
import info.isaksson.erland.hackoutline.io.SourceScanner;
import info.isaksson.erland.hackoutline.model.Def;
import info.isaksson.erland.hackoutline.pos.RelativePath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Core API for producing file outlines.
 *
 * <p>CLI and editor/server wrappers should use this class instead of wiring parser, builder and
 * renderers themselves. Outlining never fails on malformed source; only file I/O can.</p>
 */
public final class FileOutlineService {

    private static final Logger log = LogManager.getLogger(FileOutlineService.class);

    private final OutlineExtractor extractor = new OutlineExtractor();

    /** Outline of a buffer with no file name. */
    public List<Def> outline(String content) {
        return outline(RelativePath.DEFAULT, content);
    }

    public List<Def> outline(RelativePath path, String content) {
        if (path == null) throw new IllegalArgumentException("path must not be null");
        return extractor.extract(path, content == null ? "" : content);
    }

    /** Legacy flat outline of a buffer with no file name. */
    public List<LegacyEntry> outlineLegacy(String content) {
        return LegacyFlattener.flatten(outline(content));
    }

    /** Compact rendering in the given mode. */
    public String render(OutlineMode mode, RelativePath path, String content) {
        OutlineOptions options = new OutlineOptions();
        options.mode = mode;
        return render(outline(path, content), options);
    }

    /** Renders a buffer, reporting {@link OutlineOptions#fileName} in positions. */
    public String render(String content, OutlineOptions options) {
        if (options == null) options = new OutlineOptions();
        return render(outline(RelativePath.named(options.fileName), content), options);
    }

    /**
     * Outlines every Hack source file under {@code root}, keyed by '/'-separated path relative to
     * {@code root}, in scan order.
     */
    public Map<String, List<Def>> outlineDirectory(Path root, List<String> excludeGlobs) throws IOException {
        if (root == null) throw new IllegalArgumentException("root must not be null");
        List<Path> files = SourceScanner.scan(root, excludeGlobs == null ? List.of() : excludeGlobs);
        log.debug("Outlining {} file(s) under {}", files.size(), root);

        Map<String, List<Def>> out = new LinkedHashMap<>();
        for (Path file : files) {
            String rel = SourceScanner.relativeName(root, file);
            out.put(rel, outline(RelativePath.of(root, rel), readSource(file)));
        }
        return out;
    }

    /**
     * Renders a directory: JSON modes produce one object keyed by relative path, debug mode a
     * {@code == <path>} header before each file's dump.
     */
    public String renderDirectory(Path root, List<String> excludeGlobs, OutlineOptions options) throws IOException {
        if (options == null) options = new OutlineOptions();
        Map<String, List<Def>> outlines = outlineDirectory(root, excludeGlobs);

        if (!options.mode.isJson()) {
            StringBuilder sb = new StringBuilder();
            for (Map.Entry<String, List<Def>> e : outlines.entrySet()) {
                sb.append("== ").append(e.getKey()).append('\n');
                sb.append(OutlinePrinter.toText(e.getValue()));
            }
            return sb.toString();
        }

        ObjectNode obj = JsonNodeFactory.instance.objectNode();
        for (Map.Entry<String, List<Def>> e : outlines.entrySet()) {
            obj.set(e.getKey(), options.mode == OutlineMode.LEGACY
                    ? LegacyOutlineJson.fromOutline(e.getValue())
                    : OutlineJson.toJson(e.getValue()));
        }
        return OutlineJson.write(obj, options.pretty);
    }

    /** Reads a source file as UTF-8, replacing malformed bytes instead of failing. */
    public static String readSource(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    private static String render(List<Def> outline, OutlineOptions options) {
        return switch (options.mode) {
            case LEGACY -> {
                List<LegacyEntry> entries = LegacyFlattener.flatten(outline);
                yield options.pretty
                        ? LegacyOutlineJson.toPrettyJsonString(entries)
                        : LegacyOutlineJson.toJsonString(entries);
            }
            case JSON -> options.pretty
                    ? OutlineJson.toPrettyJsonString(outline)
                    : OutlineJson.toJsonString(outline);
            case DEBUG -> OutlinePrinter.toText(outline);
        };
    }
}

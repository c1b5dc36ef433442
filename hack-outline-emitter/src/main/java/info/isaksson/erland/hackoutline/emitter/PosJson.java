package info.isaksson.erland.hackoutline.emitter;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import info.isaksson.erland.hackoutline.pos.AbsolutePos;

/**
 * JSON encodings of {@link AbsolutePos}.
 *
 * <ul>
 *   <li>position: {@code {"filename", "line", "char_start", "char_end"}}</li>
 *   <li>span: {@code {"filename", "line_start", "char_start", "line_end", "char_end"}}</li>
 * </ul>
 */
public final class PosJson {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private PosJson() {}

    public static ObjectNode position(AbsolutePos pos) {
        AbsolutePos.LineInfo info = pos.lineInfo();
        ObjectNode n = NODES.objectNode();
        n.put("filename", pos.file);
        n.put("line", info.line());
        n.put("char_start", info.charStart());
        n.put("char_end", info.charEnd());
        return n;
    }

    public static ObjectNode span(AbsolutePos pos) {
        AbsolutePos.MultilineInfo info = pos.multilineInfo();
        ObjectNode n = NODES.objectNode();
        n.put("filename", pos.file);
        n.put("line_start", info.lineStart());
        n.put("char_start", info.charStart());
        n.put("line_end", info.lineEnd());
        n.put("char_end", info.charEnd());
        return n;
    }
}

package info.isaksson.erland.hackoutline.emitter;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import info.isaksson.erland.hackoutline.model.Def;
import info.isaksson.erland.hackoutline.pos.AbsolutePos;

import java.util.List;

/** Legacy flat JSON: {@code [{"name", "type", "line", "char_start", "char_end"}, ...]}. */
public final class LegacyOutlineJson {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private LegacyOutlineJson() {}

    public static ArrayNode toJson(List<LegacyEntry> entries) {
        ArrayNode arr = NODES.arrayNode();
        for (LegacyEntry e : entries) {
            AbsolutePos.LineInfo info = e.pos.lineInfo();
            ObjectNode n = arr.addObject();
            n.put("name", e.name);
            n.put("type", e.type);
            n.put("line", info.line());
            n.put("char_start", info.charStart());
            n.put("char_end", info.charEnd());
        }
        return arr;
    }

    public static ArrayNode fromOutline(List<Def> outline) {
        return toJson(LegacyFlattener.flatten(outline));
    }

    public static String toJsonString(List<LegacyEntry> entries) {
        return OutlineJson.write(toJson(entries), false);
    }

    public static String toPrettyJsonString(List<LegacyEntry> entries) {
        return OutlineJson.write(toJson(entries), true);
    }
}

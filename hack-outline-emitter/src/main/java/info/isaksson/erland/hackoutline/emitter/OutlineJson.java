package info.isaksson.erland.hackoutline.emitter;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import info.isaksson.erland.hackoutline.model.Def;
import info.isaksson.erland.hackoutline.model.Modifier;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * Structured JSON form of an outline: an array of
 * {@code {"kind", "name", "position", "span", "modifiers", "children"}} objects, nested the same way
 * as the outline.
 *
 * <p>{@link #write} is shared by the other JSON renderers.</p>
 */
public final class OutlineJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private OutlineJson() {}

    public static ArrayNode toJson(List<Def> outline) {
        ArrayNode arr = NODES.arrayNode();
        if (outline == null) return arr;
        for (Def def : outline) {
            arr.add(toJson(def));
        }
        return arr;
    }

    public static ObjectNode toJson(Def def) {
        ObjectNode n = NODES.objectNode();
        n.put("kind", def.kind.label);
        n.put("name", def.name);
        n.set("position", PosJson.position(def.pos));
        n.set("span", PosJson.span(def.span));
        ArrayNode mods = n.putArray("modifiers");
        for (Modifier m : def.modifiers) {
            mods.add(m.label);
        }
        n.set("children", toJson(def.children));
        return n;
    }

    public static String toJsonString(List<Def> outline) {
        return write(toJson(outline), false);
    }

    public static String toPrettyJsonString(List<Def> outline) {
        return write(toJson(outline), true);
    }

    /** Serializes a tree built by the renderers; pretty output ends with a newline. */
    public static String write(JsonNode node, boolean pretty) {
        try {
            if (pretty) {
                return MAPPER.writer(PRETTY).writeValueAsString(node) + "\n";
            }
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        // Prevent Jackson from closing the provided OutputStream/Writer.
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}

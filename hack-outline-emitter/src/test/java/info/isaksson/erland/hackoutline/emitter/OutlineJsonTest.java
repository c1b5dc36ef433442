package info.isaksson.erland.hackoutline.emitter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import info.isaksson.erland.hackoutline.model.Def;
import info.isaksson.erland.hackoutline.model.DefKind;
import info.isaksson.erland.hackoutline.model.Modifier;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static info.isaksson.erland.hackoutline.emitter.Defs.*;
import static org.junit.jupiter.api.Assertions.*;

public class OutlineJsonTest {

    private static List<Def> sample() {
        return List.of(
                container(DefKind.CLASS, "Job", 3, 9, List.of(
                        method("run", 4, Modifier.PUBLIC, Modifier.ASYNC),
                        member(DefKind.PROPERTY, "id", 7)),
                        Modifier.ABSTRACT, Modifier.FINAL),
                fn("helper", 11));
    }

    private static List<String> fieldNames(JsonNode n) {
        List<String> out = new ArrayList<>();
        for (Iterator<String> it = n.fieldNames(); it.hasNext(); ) out.add(it.next());
        return out;
    }

    @Test
    void treeHasExpectedShape() {
        ArrayNode arr = OutlineJson.toJson(sample());
        assertEquals(2, arr.size());

        JsonNode job = arr.get(0);
        assertEquals(List.of("kind", "name", "position", "span", "modifiers", "children"), fieldNames(job));
        assertEquals("class", job.get("kind").asText());
        assertEquals("Job", job.get("name").asText());
        assertEquals("abstract", job.get("modifiers").get(0).asText());
        assertEquals("final", job.get("modifiers").get(1).asText());

        JsonNode run = job.get("children").get(0);
        assertEquals("method", run.get("kind").asText());
        assertEquals("async", run.get("modifiers").get(1).asText());
        assertEquals(0, run.get("children").size());
        assertTrue(arr.get(1).get("modifiers").isArray());
    }

    @Test
    void positionAndSpanEncodings() {
        JsonNode job = OutlineJson.toJson(sample()).get(0);

        JsonNode position = job.get("position");
        assertEquals(List.of("filename", "line", "char_start", "char_end"), fieldNames(position));
        assertEquals("f.php", position.get("filename").asText());
        assertEquals(3, position.get("line").asInt());
        assertEquals(7, position.get("char_start").asInt());
        assertEquals(9, position.get("char_end").asInt());

        JsonNode span = job.get("span");
        assertEquals(List.of("filename", "line_start", "char_start", "line_end", "char_end"), fieldNames(span));
        assertEquals(3, span.get("line_start").asInt());
        assertEquals(1, span.get("char_start").asInt());
        assertEquals(9, span.get("line_end").asInt());
        assertEquals(1, span.get("char_end").asInt());
    }

    @Test
    void compactAndPrettyStringsParseToTheSameTree() throws Exception {
        String compact = OutlineJson.toJsonString(sample());
        String pretty = OutlineJson.toPrettyJsonString(sample());

        assertFalse(compact.contains("\n"));
        assertTrue(pretty.startsWith("[\n  {\n    \"kind\" : \"class\""), pretty);
        assertTrue(pretty.endsWith("\n"));

        ObjectMapper om = new ObjectMapper();
        assertEquals(om.readTree(compact), om.readTree(pretty));
        assertEquals(OutlineJson.toJson(sample()), om.readTree(compact));
    }

    @Test
    void emptyOutlineIsEmptyArray() {
        assertEquals("[]", OutlineJson.toJsonString(List.of()));
    }
}

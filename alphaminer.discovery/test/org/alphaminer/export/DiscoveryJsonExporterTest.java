package org.alphaminer.export;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;

import org.alphaminer.discovery.AlphaMiner;
import org.alphaminer.discovery.DiscoveryResult;
import org.alphaminer.json.JsonDocument;
import org.alphaminer.model.Trace;
import org.alphaminer.model.TraceDictionary;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class DiscoveryJsonExporterTest {

    private DiscoveryResult result;

    @BeforeEach
    public void setUp() throws Exception {
        result = new AlphaMiner().discover(TraceDictionary.builder()
            .addCount(Trace.of("a", "b", "c", "d"), 3)
            .addCount(Trace.of("a", "c", "b", "d"), 2)
            .addCount(Trace.of("a", "e", "d"), 1)
            .build());
    }

    @Test
    public void testDocumentSections() {
        JsonDocument document = new DiscoveryJsonExporter().toJson(result);

        assertEquals(result.getRunId(), document.getString("run_id", null));
        assertEquals(3, document.getArray("traces").size());
        assertEquals(10, document.getArray("directly_follows").size());
        assertEquals(8, document.getArray("independent_sets").size());
        assertEquals(11, document.getArray("transitions").size());
        assertEquals(5, document.getArray("maximal_transitions").size());
        assertEquals("[\"start\",\"a\",\"b\",\"c\",\"d\",\"e\",\"end\"]", document.getArray("nodes").toJSONString());
        assertFalse(document.getArray("stages").isEmpty());
    }

    @Test
    public void testFootprintMatrixRows() {
        JsonDocument footprint = new DiscoveryJsonExporter().toJson(result).getObject("footprint");

        assertEquals("[\"a\",\"b\",\"c\",\"d\",\"e\"]", footprint.getArray("activities").toJSONString());
        JSONArray rowA = (JSONArray) footprint.getArray("matrix").get(0);
        assertEquals("[\"#\",\"-->\",\"-->\",\"#\",\"-->\"]", rowA.toJSONString());
        JSONArray rowB = (JSONArray) footprint.getArray("matrix").get(1);
        assertEquals("||", rowB.get(2));
    }

    @Test
    public void testMaximalTransitionEntries() {
        JSONArray maximal = new DiscoveryJsonExporter().toJson(result).getArray("maximal_transitions");

        JSONObject first = (JSONObject) maximal.get(0);
        assertEquals("[\"a\"]", ((JSONArray) first.get("input")).toJSONString());
        assertEquals("[\"b\",\"e\"]", ((JSONArray) first.get("output")).toJSONString());
        assertEquals("-->", first.get("relation"));
        assertEquals(Boolean.TRUE, first.get("gateway"));

        JSONObject parallel = (JSONObject) maximal.get(2);
        assertEquals("||", parallel.get("relation"));
        assertEquals(Boolean.FALSE, parallel.get("gateway"));
    }

    @Test
    public void testWriteCreatesReadableFile(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("nested").resolve("result.json");

        new DiscoveryJsonExporter().write(result, file);

        assertTrue(Files.exists(file));
        JsonDocument reloaded = JsonDocument.loadFromFile(file);
        assertEquals(5, reloaded.getArray("maximal_transitions").size());
        JSONObject firstTrace = (JSONObject) reloaded.getArray("traces").get(0);
        assertEquals(3L, firstTrace.get("count"));
        assertEquals(0.5, ((Number) firstTrace.get("frequency")).doubleValue(), 1e-12);
    }
}

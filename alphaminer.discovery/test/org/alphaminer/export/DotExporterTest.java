package org.alphaminer.export;

import static org.junit.jupiter.api.Assertions.*;

import org.alphaminer.discovery.AlphaMiner;
import org.alphaminer.discovery.DiscoveryResult;
import org.alphaminer.model.Trace;
import org.alphaminer.model.TraceDictionary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class DotExporterTest {

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
    public void testDirectlyFollowsGraphFiltersByCount() {
        String dot = DotExporter.exportDirectlyFollows(result, 3);

        assertTrue(dot.startsWith("digraph DirectlyFollows {"));
        assertTrue(dot.contains("\"start\" -> \"a\" [label=\"6\""));
        assertTrue(dot.contains("\"a\" -> \"b\" [label=\"3\""));
        assertFalse(dot.contains("\"a\" -> \"c\""));
        assertTrue(dot.contains("  \"e\";\n"), "filtered nodes stay in the graph");
        assertTrue(dot.trim().endsWith("}"));
    }

    @Test
    public void testDirectlyFollowsGraphWithAllEdges() {
        String dot = DotExporter.exportDirectlyFollows(result, 1);

        assertTrue(dot.contains("\"a\" -> \"e\" [label=\"1\""));
        assertEquals(result.getDirectlyFollows().size(), countOccurrences(dot, "[label="));
    }

    @Test
    public void testProcessDiagramConnectors() {
        String dot = DotExporter.exportProcess(result);

        assertTrue(dot.startsWith("digraph Process {"));
        assertTrue(dot.contains("\"transition_0\" [shape=circle, label=\"x\""));
        assertTrue(dot.contains("\"a\" -> \"transition_0\";"));
        assertTrue(dot.contains("\"transition_0\" -> \"b\";"));
        assertTrue(dot.contains("\"transition_0\" -> \"e\";"));
        assertTrue(dot.contains("\"gateway_2\" [shape=circle, label=\"+\""));
        assertTrue(dot.contains("\"b\" -> \"gateway_2\" [dir=none];"));
        assertTrue(dot.contains("\"start\" -> \"a\";"));
        assertTrue(dot.contains("\"d\" -> \"end\";"));
        assertEquals(5, countOccurrences(dot, "[shape=circle, label="));
    }

    @Test
    public void testEmptyResultHasNoBoundaries() throws Exception {
        String dot = DotExporter.exportProcess(new AlphaMiner().discover(TraceDictionary.empty()));

        assertFalse(dot.contains("\"start\""));
        assertTrue(dot.trim().endsWith("}"));
    }

    @Test
    public void testLabelsAreEscaped() throws Exception {
        DiscoveryResult quoted = new AlphaMiner().discover(TraceDictionary.builder()
            .addCount(Trace.of("say \"hi\"", "leave"), 1)
            .build());

        assertTrue(DotExporter.exportProcess(quoted).contains("\"say \\\"hi\\\"\""));
    }

    private static int countOccurrences(String text, String fragment) {
        int count = 0;
        for (int i = text.indexOf(fragment); i >= 0; i = text.indexOf(fragment, i + 1)) {
            count++;
        }
        return count;
    }
}

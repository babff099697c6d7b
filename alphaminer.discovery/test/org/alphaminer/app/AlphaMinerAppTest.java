package org.alphaminer.app;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.alphaminer.config.MinerParameters;
import org.alphaminer.discovery.DiscoveryResult;
import org.alphaminer.exceptions.MinerConfigurationException;
import org.alphaminer.exceptions.SchemaException;
import org.alphaminer.json.JsonDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class AlphaMinerAppTest {

    @TempDir
    Path outputDirectory;

    private MinerParameters parameters;

    @BeforeEach
    public void setUp() throws Exception {
        parameters = MinerParameters.defaults();
        parameters.setAnalysedLogPath(Paths.get(AlphaMinerAppTest.class.getResource("/logs").toURI()));
        parameters.setOutputPath(outputDirectory);
    }

    @Test
    public void testRunWritesAllOutputs() throws Exception {
        parameters.setTestedFile("worked_example.csv");
        parameters.setMinEdgeCount(2);

        DiscoveryResult result = new AlphaMinerApp().run(parameters);

        assertEquals(5, result.getMaximalTransitions().size());
        Path json = outputDirectory.resolve("worked_example.csv.result.json");
        Path dfg = outputDirectory.resolve("worked_example.csv.dfg.dot");
        Path process = outputDirectory.resolve("worked_example.csv.process.dot");
        assertTrue(Files.exists(json));
        assertTrue(Files.exists(dfg));
        assertTrue(Files.exists(process));

        assertEquals(result.getRunId(), JsonDocument.loadFromFile(json).getString("run_id", null));
        String dfgText = new String(Files.readAllBytes(dfg), StandardCharsets.UTF_8);
        assertTrue(dfgText.contains("\"a\" -> \"c\" [label=\"2\""));
        assertFalse(dfgText.contains("\"a\" -> \"e\""));
        assertTrue(new String(Files.readAllBytes(process), StandardCharsets.UTF_8).contains("digraph Process"));
    }

    @Test
    public void testRunWithFrequencyThreshold() throws Exception {
        parameters.setTestedFile("worked_example.csv");
        parameters.setMinFrequency(0.2);

        DiscoveryResult result = new AlphaMinerApp().run(parameters);

        assertEquals(2, result.getTraceDictionary().size());
        assertFalse(result.getFootprint().getActivities().contains("e"));
    }

    @Test
    public void testRunWithoutTestedFile() {
        MinerConfigurationException e = assertThrows(MinerConfigurationException.class,
            () -> new AlphaMinerApp().run(parameters));
        assertEquals(MinerParameters.TESTED_FILE, e.getParameter());
    }

    @Test
    public void testRunStopsOnSchemaError() {
        parameters.setTestedFile("missing_activity.csv");

        assertThrows(SchemaException.class, () -> new AlphaMinerApp().run(parameters));
        assertFalse(Files.exists(outputDirectory.resolve("missing_activity.csv.result.json")));
    }
}

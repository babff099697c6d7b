package org.alphaminer.app;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.alphaminer.config.MinerParameters;
import org.alphaminer.discovery.AlphaMiner;
import org.alphaminer.discovery.DiscoveryResult;
import org.alphaminer.exceptions.MinerConfigurationException;
import org.alphaminer.exceptions.MiningException;
import org.alphaminer.export.DiscoveryJsonExporter;
import org.alphaminer.export.DotExporter;
import org.alphaminer.io.EventLogCsvReader;
import org.alphaminer.model.EventRecord;
import org.alphaminer.model.Transition;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

/**
 * Command-line entry point.
 *
 * Usage: AlphaMinerApp &lt;parameters.json&gt;
 *
 * Reads the configured CSV log, runs discovery and writes next to it (or to output_path):
 *   &lt;log&gt;.result.json   full result
 *   &lt;log&gt;.dfg.dot       directly-follows graph
 *   &lt;log&gt;.process.dot   discovered process
 */
public class AlphaMinerApp {

    private static final Logger logger = Logger.getLogger(AlphaMinerApp.class);

    private static final String LOG_PATTERN = "%d{ISO8601} %-5p [%c{1}] %m%n";

    public static void main(String[] args) {
        if (args.length != 1) {
            System.err.println("Usage: AlphaMinerApp <parameters.json>");
            System.exit(2);
        }

        try {
            MinerParameters parameters = MinerParameters.load(Paths.get(args[0]));
            configureFileLogging(parameters);
            new AlphaMinerApp().run(parameters);
        } catch (MiningException e) {
            logger.error("Discovery failed: " + e, e);
            System.exit(1);
        } catch (IOException e) {
            logger.error("I/O error: " + e.getMessage(), e);
            System.exit(1);
        }
    }

    /**
     * Read, discover and export. Returns the result for callers embedding the application.
     */
    public DiscoveryResult run(MinerParameters parameters) throws MiningException, IOException {
        Path logFile = parameters.getTestedFilePath();
        if (logFile == null) {
            throw new MinerConfigurationException("No log to analyse: " + MinerParameters.TESTED_FILE
                + " is not set", MinerParameters.TESTED_FILE);
        }

        logger.info("=== ALPHA MINER: " + logFile + " ===");
        List<EventRecord> events = new EventLogCsvReader(parameters).read(logFile);
        DiscoveryResult result = new AlphaMiner(parameters).discover(events);

        logger.info("Initial activities: " + result.getBoundaries().getInitialActivities());
        logger.info("Final activities: " + result.getBoundaries().getFinalActivities());
        logger.info("Footprint matrix:\n" + result.getFootprint());
        logger.info("Independent sets: " + result.getIndependentSets());
        for (Transition transition : result.getMaximalTransitions()) {
            logger.info("Maximal transition: " + transition + (transition.isGateway() ? " (gateway)" : ""));
        }

        export(result, parameters);
        return result;
    }

    private void export(DiscoveryResult result, MinerParameters parameters) throws IOException {
        Path outputDirectory = parameters.getOutputPath();
        Files.createDirectories(outputDirectory);
        String baseName = parameters.getTestedFile();

        new DiscoveryJsonExporter().write(result, outputDirectory.resolve(baseName + ".result.json"));

        Path dfgFile = outputDirectory.resolve(baseName + ".dfg.dot");
        Files.write(dfgFile, DotExporter.exportDirectlyFollows(result, parameters.getMinEdgeCount())
            .getBytes(StandardCharsets.UTF_8));
        Path processFile = outputDirectory.resolve(baseName + ".process.dot");
        Files.write(processFile, DotExporter.exportProcess(result)
            .getBytes(StandardCharsets.UTF_8));
        logger.info("DOT graphs written to " + dfgFile + " and " + processFile);
    }

    private static void configureFileLogging(MinerParameters parameters) throws IOException {
        if (parameters.getLogFileName() == null) {
            return;
        }
        Path logPath = parameters.getOutputPath().resolve(parameters.getLogFileName());
        Path parent = logPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        FileAppender appender = new FileAppender(new PatternLayout(LOG_PATTERN), logPath.toString(), true);
        appender.setName("parametersFile");
        Logger.getRootLogger().addAppender(appender);
        logger.info("Logging to " + logPath);
    }
}

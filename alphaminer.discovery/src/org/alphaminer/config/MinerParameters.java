package org.alphaminer.config;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.alphaminer.constants.MinerConstants;
import org.alphaminer.exceptions.MinerConfigurationException;
import org.alphaminer.io.ReservedLabelPolicy;
import org.alphaminer.json.JsonDocument;
import org.apache.log4j.Logger;
import org.json.simple.parser.ParseException;

/**
 * Run parameters, read from a JSON parameters file.
 *
 * <pre>
 * {
 *   "analysed_log_path": "logs",
 *   "tested_file": "orders.csv",
 *   "log_file_name": "alphaminer.log",
 *   "min_frequency": 0.05,
 *   "min_edge_count": 2,
 *   "reserved_label_policy": "RENAME",
 *   "max_activities": 22,
 *   "parallel": false,
 *   "output_path": "out"
 * }
 * </pre>
 *
 * Every key is optional except {@code tested_file}, which only the command-line entry point needs.
 */
public class MinerParameters {

    private static final Logger logger = Logger.getLogger(MinerParameters.class);

    public static final String ANALYSED_LOG_PATH = "analysed_log_path";
    public static final String TESTED_FILE = "tested_file";
    public static final String LOG_FILE_NAME = "log_file_name";
    public static final String MIN_FREQUENCY = "min_frequency";
    public static final String MIN_EDGE_COUNT = "min_edge_count";
    public static final String CASE_ID_COLUMN = "case_id_column";
    public static final String ACTIVITY_COLUMN = "activity_column";
    public static final String TIMESTAMP_COLUMN = "timestamp_column";
    public static final String RESERVED_LABEL_POLICY = "reserved_label_policy";
    public static final String MAX_ACTIVITIES = "max_activities";
    public static final String PARALLEL = "parallel";
    public static final String OUTPUT_PATH = "output_path";

    private Path analysedLogPath = Paths.get(".");
    private String testedFile;
    private String logFileName;
    private double minFrequency = 0.0;
    private long minEdgeCount = MinerConstants.DEFAULT_MIN_EDGE_COUNT;
    private String caseIdColumn = MinerConstants.CASE_ID_COLUMN;
    private String activityColumn = MinerConstants.ACTIVITY_COLUMN;
    private String timestampColumn = MinerConstants.TIMESTAMP_COLUMN;
    private ReservedLabelPolicy reservedLabelPolicy = ReservedLabelPolicy.REJECT;
    private int maxActivities = MinerConstants.DEFAULT_MAX_ACTIVITIES;
    private boolean parallel = false;
    private Path outputPath;

    /**
     * Parameters with every default in place
     */
    public static MinerParameters defaults() {
        return new MinerParameters();
    }

    public static MinerParameters load(Path file) throws MinerConfigurationException {
        JsonDocument document;
        try {
            document = JsonDocument.loadFromFile(file);
        } catch (IOException e) {
            throw new MinerConfigurationException("Cannot read parameters file " + file, file.toString(), e);
        } catch (ParseException e) {
            throw new MinerConfigurationException("Parameters file " + file + " is not a JSON object: " + e,
                file.toString(), e);
        }
        MinerParameters parameters = fromJson(document);
        logger.info("Loaded parameters from " + file + ": " + parameters);
        return parameters;
    }

    public static MinerParameters fromJson(JsonDocument document) throws MinerConfigurationException {
        MinerParameters parameters = new MinerParameters();

        if (document.hasKey(ANALYSED_LOG_PATH)) {
            parameters.setAnalysedLogPath(Paths.get(requireString(document, ANALYSED_LOG_PATH)));
        }
        if (document.hasKey(TESTED_FILE)) {
            parameters.setTestedFile(requireString(document, TESTED_FILE));
        }
        if (document.hasKey(LOG_FILE_NAME)) {
            parameters.setLogFileName(requireString(document, LOG_FILE_NAME));
        }
        if (document.hasKey(MIN_FREQUENCY)) {
            parameters.setMinFrequency(requireNumber(document, MIN_FREQUENCY).doubleValue());
        }
        if (document.hasKey(MIN_EDGE_COUNT)) {
            parameters.setMinEdgeCount(requireWholeNumber(document, MIN_EDGE_COUNT));
        }
        if (document.hasKey(CASE_ID_COLUMN)) {
            parameters.setCaseIdColumn(requireString(document, CASE_ID_COLUMN));
        }
        if (document.hasKey(ACTIVITY_COLUMN)) {
            parameters.setActivityColumn(requireString(document, ACTIVITY_COLUMN));
        }
        if (document.hasKey(TIMESTAMP_COLUMN)) {
            parameters.setTimestampColumn(requireString(document, TIMESTAMP_COLUMN));
        }
        if (document.hasKey(RESERVED_LABEL_POLICY)) {
            String policy = requireString(document, RESERVED_LABEL_POLICY);
            try {
                parameters.setReservedLabelPolicy(ReservedLabelPolicy.valueOf(policy.trim().toUpperCase()));
            } catch (IllegalArgumentException e) {
                throw new MinerConfigurationException("Unknown reserved label policy: " + policy,
                    RESERVED_LABEL_POLICY, e);
            }
        }
        if (document.hasKey(MAX_ACTIVITIES)) {
            long max = requireWholeNumber(document, MAX_ACTIVITIES);
            if (max > Integer.MAX_VALUE) {
                throw new MinerConfigurationException(MAX_ACTIVITIES + " is too large: " + max, MAX_ACTIVITIES);
            }
            parameters.setMaxActivities((int) max);
        }
        if (document.hasKey(PARALLEL)) {
            Object value = document.get(PARALLEL);
            if (!(value instanceof Boolean)) {
                throw new MinerConfigurationException(PARALLEL + " must be true or false: " + value, PARALLEL);
            }
            parameters.setParallel((Boolean) value);
        }
        if (document.hasKey(OUTPUT_PATH)) {
            parameters.setOutputPath(Paths.get(requireString(document, OUTPUT_PATH)));
        }

        parameters.validate();
        return parameters;
    }

    /**
     * Check value ranges
     */
    public void validate() throws MinerConfigurationException {
        if (Double.isNaN(minFrequency) || minFrequency < 0.0 || minFrequency > 1.0) {
            throw new MinerConfigurationException(MIN_FREQUENCY + " must be within [0, 1]: " + minFrequency,
                MIN_FREQUENCY);
        }
        if (minEdgeCount < 1) {
            throw new MinerConfigurationException(MIN_EDGE_COUNT + " must be at least 1: " + minEdgeCount,
                MIN_EDGE_COUNT);
        }
        if (maxActivities < 1) {
            throw new MinerConfigurationException(MAX_ACTIVITIES + " must be at least 1: " + maxActivities,
                MAX_ACTIVITIES);
        }
        if (isBlank(caseIdColumn) || isBlank(activityColumn) || isBlank(timestampColumn)) {
            throw new MinerConfigurationException("Column names cannot be empty", CASE_ID_COLUMN);
        }
    }

    private static String requireString(JsonDocument document, String key) throws MinerConfigurationException {
        Object value = document.get(key);
        if (!(value instanceof String) || ((String) value).trim().isEmpty()) {
            throw new MinerConfigurationException(key + " must be a non-empty string: " + value, key);
        }
        return (String) value;
    }

    private static Number requireNumber(JsonDocument document, String key) throws MinerConfigurationException {
        Object value = document.get(key);
        if (!(value instanceof Number)) {
            throw new MinerConfigurationException(key + " must be a number: " + value, key);
        }
        return (Number) value;
    }

    private static long requireWholeNumber(JsonDocument document, String key) throws MinerConfigurationException {
        Number value = requireNumber(document, key);
        if (!(value instanceof Long)) {
            throw new MinerConfigurationException(key + " must be a whole number: " + value, key);
        }
        return value.longValue();
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    // Getters and setters

    public Path getAnalysedLogPath() { return analysedLogPath; }
    public void setAnalysedLogPath(Path analysedLogPath) { this.analysedLogPath = analysedLogPath; }

    public String getTestedFile() { return testedFile; }
    public void setTestedFile(String testedFile) { this.testedFile = testedFile; }

    public String getLogFileName() { return logFileName; }
    public void setLogFileName(String logFileName) { this.logFileName = logFileName; }

    public double getMinFrequency() { return minFrequency; }
    public void setMinFrequency(double minFrequency) { this.minFrequency = minFrequency; }

    public long getMinEdgeCount() { return minEdgeCount; }
    public void setMinEdgeCount(long minEdgeCount) { this.minEdgeCount = minEdgeCount; }

    public String getCaseIdColumn() { return caseIdColumn; }
    public void setCaseIdColumn(String caseIdColumn) { this.caseIdColumn = caseIdColumn; }

    public String getActivityColumn() { return activityColumn; }
    public void setActivityColumn(String activityColumn) { this.activityColumn = activityColumn; }

    public String getTimestampColumn() { return timestampColumn; }
    public void setTimestampColumn(String timestampColumn) { this.timestampColumn = timestampColumn; }

    public ReservedLabelPolicy getReservedLabelPolicy() { return reservedLabelPolicy; }
    public void setReservedLabelPolicy(ReservedLabelPolicy reservedLabelPolicy) { this.reservedLabelPolicy = reservedLabelPolicy; }

    public int getMaxActivities() { return maxActivities; }
    public void setMaxActivities(int maxActivities) { this.maxActivities = maxActivities; }

    public boolean isParallel() { return parallel; }
    public void setParallel(boolean parallel) { this.parallel = parallel; }

    /**
     * Output directory; falls back to the analysed log directory
     */
    public Path getOutputPath() { return outputPath != null ? outputPath : analysedLogPath; }
    public void setOutputPath(Path outputPath) { this.outputPath = outputPath; }

    /**
     * Full path of the log to analyse, or null when no file is configured
     */
    public Path getTestedFilePath() {
        return testedFile != null ? analysedLogPath.resolve(testedFile) : null;
    }

    @Override
    public String toString() {
        return String.format("MinerParameters[log=%s, minFrequency=%s, minEdgeCount=%d, policy=%s, "
            + "maxActivities=%d, parallel=%b, output=%s]",
            getTestedFilePath(), minFrequency, minEdgeCount, reservedLabelPolicy, maxActivities, parallel,
            getOutputPath());
    }
}

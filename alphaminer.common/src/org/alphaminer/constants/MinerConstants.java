package org.alphaminer.constants;

/**
 * Centralized constants shared by ingestion, discovery and export.
 *
 * BOUNDARY MARKERS:
 *   "start" and "end" are synthetic activities added around every trace when the
 *   directly-follows relation is built. Real activities must never carry these labels;
 *   ingestion rejects or renames them (see {@link #RESERVED_RENAME_SUFFIX}).
 *
 * SOFT CEILING:
 *   Independent-set enumeration is exponential in the number of distinct activities.
 *   Above {@link #DEFAULT_MAX_ACTIVITIES} the run still proceeds but a warning is logged.
 */
public class MinerConstants {

    // Boundary markers
    public static final String START = "start";
    public static final String END = "end";

    // Appended to a real activity that collides with a boundary marker under the RENAME policy
    public static final String RESERVED_RENAME_SUFFIX = "_activity";

    // Default CSV header names
    public static final String CASE_ID_COLUMN = "case_id";
    public static final String ACTIVITY_COLUMN = "activity_name";
    public static final String TIMESTAMP_COLUMN = "timestamp";

    public static final int DEFAULT_MAX_ACTIVITIES = 22;
    public static final int DEFAULT_MIN_EDGE_COUNT = 1;

    // Footprint symbols, as printed in matrices and exports
    public static final String SYMBOL_CAUSAL_FORWARD = "-->";
    public static final String SYMBOL_CAUSAL_BACKWARD = "<--";
    public static final String SYMBOL_PARALLEL = "||";
    public static final String SYMBOL_INDEPENDENT = "#";

    // Slack for frequency comparisons, which are rounded quotients
    public static final double FREQUENCY_TOLERANCE = 1e-9;

    private MinerConstants() {
    }

    /**
     * Check if a label is one of the boundary markers
     */
    public static boolean isReserved(String label) {
        return START.equals(label) || END.equals(label);
    }

    /**
     * Replacement label for a real activity that collides with a boundary marker
     */
    public static String renameReserved(String label) {
        return label + RESERVED_RENAME_SUFFIX;
    }
}

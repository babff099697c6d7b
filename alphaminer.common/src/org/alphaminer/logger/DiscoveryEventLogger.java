package org.alphaminer.logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

/**
 * Discovery Event Logger
 *
 * Records one event per pipeline stage of a single discovery run:
 * - stage start and completion
 * - size of the structure the stage produced
 * - elapsed time
 * - soft-limit warnings
 *
 * Every event is also written through log4j. One instance per run; the history
 * becomes part of the run summary and of the JSON export.
 */
public class DiscoveryEventLogger {

    private static final Logger logger = Logger.getLogger(DiscoveryEventLogger.class);

    private final String runId;
    private final List<StageEvent> eventHistory = new ArrayList<>();

    public DiscoveryEventLogger(String runId) {
        this.runId = runId;
    }

    // ========== Stage Events ==========

    /**
     * Mark the start of a stage, returning the start time to pass to {@link #logStageCompleted}
     */
    public long logStageStarted(String stage) {
        if (logger.isDebugEnabled()) {
            logger.debug(String.format("STAGE_STARTED: run=%s, stage=%s", runId, stage));
        }
        return System.nanoTime();
    }

    /**
     * Log stage completion with the size of its output
     */
    public void logStageCompleted(String stage, int outputSize, long startNanos) {
        long elapsedMillis = (System.nanoTime() - startNanos) / 1_000_000L;
        String message = String.format(
            "STAGE_COMPLETED: run=%s, stage=%s, outputSize=%d, elapsed=%dms",
            runId, stage, outputSize, elapsedMillis
        );
        log(message);
        eventHistory.add(new StageEvent("STAGE_COMPLETED", stage, outputSize, elapsedMillis, message));
    }

    /**
     * Log a soft-limit breach (the run continues)
     */
    public void logLimitExceeded(String stage, int actual, int limit) {
        String message = String.format(
            "LIMIT_EXCEEDED: run=%s, stage=%s, actual=%d, limit=%d",
            runId, stage, actual, limit
        );
        logWarn(message);
        eventHistory.add(new StageEvent("LIMIT_EXCEEDED", stage, actual, 0, message));
    }

    // ========== Helper Methods ==========

    private void log(String message) {
        logger.info(message);
    }

    private void logWarn(String message) {
        logger.warn(message);
    }

    // ========== Query Methods ==========

    public String getRunId() {
        return runId;
    }

    public List<StageEvent> getEventHistory() {
        return Collections.unmodifiableList(new ArrayList<>(eventHistory));
    }

    /**
     * Completed stages only, in execution order
     */
    public List<StageEvent> getCompletedStages() {
        List<StageEvent> completed = new ArrayList<>();
        for (StageEvent event : eventHistory) {
            if ("STAGE_COMPLETED".equals(event.getEventType())) {
                completed.add(event);
            }
        }
        return completed;
    }

    // ========== Inner Classes ==========

    /**
     * Stage Event
     */
    public static class StageEvent {
        private final String eventType;
        private final String stage;
        private final int size;
        private final long elapsedMillis;
        private final String message;

        public StageEvent(String eventType, String stage, int size, long elapsedMillis, String message) {
            this.eventType = eventType;
            this.stage = stage;
            this.size = size;
            this.elapsedMillis = elapsedMillis;
            this.message = message;
        }

        public String getEventType() { return eventType; }
        public String getStage() { return stage; }
        public int getSize() { return size; }
        public long getElapsedMillis() { return elapsedMillis; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return String.format("%s: %s", eventType, message);
        }
    }
}

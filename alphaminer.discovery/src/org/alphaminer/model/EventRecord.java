package org.alphaminer.model;

import java.time.Instant;

import org.alphaminer.utils.TimeStampUtils;

/**
 * One row of an event log: which activity a case executed, and when.
 *
 * Fields are not checked here; {@code TraceAggregator} rejects a record with a missing field
 * with a {@code SchemaException}.
 */
public class EventRecord {
    public final String caseId;
    public final String activityName;
    public final Instant timestamp;

    public EventRecord(String caseId, String activityName, Instant timestamp) {
        this.caseId = caseId;
        this.activityName = activityName;
        this.timestamp = timestamp;
    }

    @Override
    public String toString() {
        return String.format("Event[case=%s, activity=%s, at=%s]", caseId, activityName,
            timestamp != null ? TimeStampUtils.formatTimestamp(timestamp) : null);
    }
}

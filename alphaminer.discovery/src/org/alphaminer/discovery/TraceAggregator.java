package org.alphaminer.discovery;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.alphaminer.constants.MinerConstants;
import org.alphaminer.exceptions.ReservedLabelException;
import org.alphaminer.exceptions.SchemaException;
import org.alphaminer.io.ReservedLabelPolicy;
import org.alphaminer.model.EventRecord;
import org.alphaminer.model.Trace;
import org.alphaminer.model.TraceDictionary;
import org.alphaminer.model.TraceStatistics;
import org.apache.log4j.Logger;

/**
 * Groups event records into one trace per case and counts identical traces.
 *
 * Records of a case are ordered by timestamp with a stable sort, so events sharing a timestamp
 * keep their order of appearance in the log. Frequencies are relative to the number of cases.
 *
 * Under {@link ReservedLabelPolicy#RENAME} a real activity named like a boundary marker gets the
 * first of {@code start_activity}, {@code start_activity_2}, ... that no other activity in the log uses.
 */
public class TraceAggregator {

    private static final Logger logger = Logger.getLogger(TraceAggregator.class);

    private static final Comparator<EventRecord> BY_TIMESTAMP = Comparator.comparing(event -> event.timestamp);

    private final ReservedLabelPolicy reservedLabelPolicy;

    public TraceAggregator() {
        this(ReservedLabelPolicy.REJECT);
    }

    public TraceAggregator(ReservedLabelPolicy reservedLabelPolicy) {
        this.reservedLabelPolicy = Objects.requireNonNull(reservedLabelPolicy, "reservedLabelPolicy cannot be null");
    }

    /**
     * @throws SchemaException if a record lacks its case id, activity or timestamp; the row is the
     *                         1-based position of the record in the list
     */
    public TraceDictionary aggregate(List<EventRecord> events) throws SchemaException, ReservedLabelException {
        Objects.requireNonNull(events, "events cannot be null");

        // Group by case, keeping first-seen case order
        Map<String, List<EventRecord>> eventsByCase = new LinkedHashMap<>();
        Set<String> labels = new HashSet<>();
        long row = 0;
        for (EventRecord event : events) {
            row++;
            requireFields(event, row);
            labels.add(event.activityName);
            eventsByCase.computeIfAbsent(event.caseId, k -> new ArrayList<>()).add(event);
        }

        Map<String, String> renamed = new HashMap<>();
        Map<Trace, Integer> counts = new HashMap<>();
        for (Map.Entry<String, List<EventRecord>> entry : eventsByCase.entrySet()) {
            List<EventRecord> caseEvents = entry.getValue();
            caseEvents.sort(BY_TIMESTAMP);

            List<String> activities = new ArrayList<>(caseEvents.size());
            for (EventRecord event : caseEvents) {
                activities.add(checkLabel(event.activityName, entry.getKey(), labels, renamed));
            }
            counts.merge(new Trace(activities), 1, Integer::sum);
        }

        int totalCases = eventsByCase.size();
        List<Map.Entry<Trace, Integer>> ordered = new ArrayList<>(counts.entrySet());
        ordered.sort(Map.Entry.<Trace, Integer>comparingByValue().reversed()
            .thenComparing(Map.Entry.<Trace, Integer>comparingByKey()));

        Map<Trace, TraceStatistics> entries = new LinkedHashMap<>();
        for (Map.Entry<Trace, Integer> entry : ordered) {
            int count = entry.getValue();
            entries.put(entry.getKey(), new TraceStatistics(count, (double) count / totalCases));
        }

        logger.info("Aggregated " + events.size() + " events of " + totalCases + " cases into "
            + entries.size() + " distinct traces");
        return new TraceDictionary(entries);
    }

    private static void requireFields(EventRecord event, long row) throws SchemaException {
        if (event.caseId == null || event.caseId.trim().isEmpty()) {
            throw new SchemaException("Event " + row + " has no case id", MinerConstants.CASE_ID_COLUMN, row);
        }
        if (event.activityName == null || event.activityName.trim().isEmpty()) {
            throw new SchemaException("Event " + row + " of case " + event.caseId + " has no activity",
                MinerConstants.ACTIVITY_COLUMN, row);
        }
        if (event.timestamp == null) {
            throw new SchemaException("Event " + row + " of case " + event.caseId + " has no timestamp",
                MinerConstants.TIMESTAMP_COLUMN, row);
        }
    }

    private String checkLabel(String activity, String caseId, Set<String> labels, Map<String, String> renamed)
            throws ReservedLabelException {
        if (!MinerConstants.isReserved(activity)) {
            return activity;
        }
        if (reservedLabelPolicy == ReservedLabelPolicy.REJECT) {
            throw new ReservedLabelException(
                "Activity '" + activity + "' collides with a boundary marker", activity, caseId);
        }
        String replacement = renamed.get(activity);
        if (replacement == null) {
            replacement = freeLabel(activity, labels);
            labels.add(replacement);
            renamed.put(activity, replacement);
            logger.warn("Activity '" + activity + "' (first seen in case " + caseId + ") renamed to '"
                + replacement + "'");
        }
        return replacement;
    }

    private static String freeLabel(String activity, Set<String> labels) {
        String base = MinerConstants.renameReserved(activity);
        String candidate = base;
        for (int n = 2; labels.contains(candidate); n++) {
            candidate = base + "_" + n;
        }
        return candidate;
    }
}

package org.alphaminer.discovery;

import java.util.HashMap;
import java.util.Map;

import org.alphaminer.constants.MinerConstants;
import org.alphaminer.exceptions.TraceValidationException;
import org.alphaminer.model.ActivityPair;
import org.alphaminer.model.Boundaries;
import org.alphaminer.model.DirectlyFollowsRelation;
import org.alphaminer.model.Trace;
import org.alphaminer.model.TraceDictionary;
import org.alphaminer.model.TraceStatistics;
import org.apache.log4j.Logger;

/**
 * Counts immediate successions, weighted by the number of cases following each trace.
 * Edges from {@code start} and to {@code end} are added for initial and final activities.
 */
public class DirectlyFollowsBuilder {

    private static final Logger logger = Logger.getLogger(DirectlyFollowsBuilder.class);

    public DirectlyFollowsRelation build(TraceDictionary dictionary, Boundaries boundaries)
            throws TraceValidationException {
        validateCounts(dictionary, "directly-follows");
        Map<ActivityPair, Long> edges = new HashMap<>();

        for (Map.Entry<Trace, TraceStatistics> entry : dictionary.asMap().entrySet()) {
            Trace trace = entry.getKey();
            int count = entry.getValue().count;

            if (boundaries.getInitialActivities().contains(trace.first())) {
                edges.merge(new ActivityPair(MinerConstants.START, trace.first()), (long) count, Long::sum);
            }
            for (int i = 0; i < trace.length() - 1; i++) {
                edges.merge(new ActivityPair(trace.get(i), trace.get(i + 1)), (long) count, Long::sum);
            }
            if (boundaries.getFinalActivities().contains(trace.last())) {
                edges.merge(new ActivityPair(trace.last(), MinerConstants.END), (long) count, Long::sum);
            }
        }

        if (logger.isDebugEnabled()) {
            for (Map.Entry<ActivityPair, Long> edge : edges.entrySet()) {
                logger.debug("Directly-follows " + edge.getKey() + " = " + edge.getValue());
            }
        }
        return new DirectlyFollowsRelation(edges);
    }

    /**
     * Every trace must be followed by at least one case.
     *
     * @throws TraceValidationException naming the first trace with a count below 1
     */
    static void validateCounts(TraceDictionary dictionary, String stage) throws TraceValidationException {
        for (Map.Entry<Trace, TraceStatistics> entry : dictionary.asMap().entrySet()) {
            int count = entry.getValue().count;
            if (count <= 0) {
                Trace trace = entry.getKey();
                throw new TraceValidationException(
                    "Count for trace " + trace + " is not a positive integer: " + count,
                    stage, trace.toString(), count);
            }
        }
    }
}

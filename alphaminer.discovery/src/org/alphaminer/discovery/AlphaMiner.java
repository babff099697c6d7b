package org.alphaminer.discovery;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

import org.alphaminer.config.MinerParameters;
import org.alphaminer.exceptions.MiningException;
import org.alphaminer.exceptions.TraceValidationException;
import org.alphaminer.logger.DiscoveryEventLogger;
import org.alphaminer.logger.DiscoveryEventLogger.StageEvent;
import org.alphaminer.model.ActivitySet;
import org.alphaminer.model.Boundaries;
import org.alphaminer.model.DirectlyFollowsRelation;
import org.alphaminer.model.EventRecord;
import org.alphaminer.model.FootprintMatrix;
import org.alphaminer.model.Transition;
import org.alphaminer.model.TraceDictionary;
import org.apache.log4j.Logger;

/**
 * Runs the discovery pipeline:
 *
 * <pre>
 *   events -> TraceAggregator -> [TraceFrequencyFilter] -> BoundaryIdentifier
 *          -> DirectlyFollowsBuilder -> FootprintBuilder -> IndependentSetEnumerator
 *          -> TransitionDiscoverer -> MaximalSetFilter
 * </pre>
 *
 * Each stage reads the previous stage's immutable output. The miner holds no state between runs,
 * so one instance can serve any number of runs.
 */
public class AlphaMiner {

    private static final Logger logger = Logger.getLogger(AlphaMiner.class);

    private final MinerParameters parameters;

    private final TraceAggregator traceAggregator;
    private final TraceFrequencyFilter frequencyFilter = new TraceFrequencyFilter();
    private final BoundaryIdentifier boundaryIdentifier = new BoundaryIdentifier();
    private final DirectlyFollowsBuilder directlyFollowsBuilder = new DirectlyFollowsBuilder();
    private final FootprintBuilder footprintBuilder = new FootprintBuilder();
    private final IndependentSetEnumerator independentSetEnumerator = new IndependentSetEnumerator();
    private final TransitionDiscoverer transitionDiscoverer;
    private final MaximalSetFilter maximalSetFilter = new MaximalSetFilter();

    public AlphaMiner() {
        this(MinerParameters.defaults());
    }

    public AlphaMiner(MinerParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters, "parameters cannot be null");
        this.traceAggregator = new TraceAggregator(parameters.getReservedLabelPolicy());
        this.transitionDiscoverer = new TransitionDiscoverer(parameters.isParallel());
    }

    /**
     * Aggregate raw events into traces, then discover
     */
    public DiscoveryResult discover(List<EventRecord> events) throws MiningException {
        DiscoveryEventLogger eventLogger = newRunLogger();
        long started = eventLogger.logStageStarted("aggregate");
        TraceDictionary dictionary = traceAggregator.aggregate(events);
        eventLogger.logStageCompleted("aggregate", dictionary.size(), started);
        return run(dictionary, eventLogger);
    }

    /**
     * Discover from an already aggregated dictionary
     */
    public DiscoveryResult discover(TraceDictionary dictionary) throws TraceValidationException {
        return run(dictionary, newRunLogger());
    }

    private DiscoveryResult run(TraceDictionary dictionary, DiscoveryEventLogger eventLogger)
            throws TraceValidationException {
        // Before the filter: a zero count has zero frequency
        long started = eventLogger.logStageStarted("validate");
        DirectlyFollowsBuilder.validateCounts(dictionary, "validate");
        eventLogger.logStageCompleted("validate", dictionary.size(), started);

        started = eventLogger.logStageStarted("frequency-filter");
        TraceDictionary filtered = frequencyFilter.filter(dictionary, parameters.getMinFrequency());
        eventLogger.logStageCompleted("frequency-filter", filtered.size(), started);

        started = eventLogger.logStageStarted("boundaries");
        Boundaries boundaries = boundaryIdentifier.identify(filtered);
        eventLogger.logStageCompleted("boundaries", boundaries.getNodes().size(), started);

        started = eventLogger.logStageStarted("directly-follows");
        DirectlyFollowsRelation directlyFollows = directlyFollowsBuilder.build(filtered, boundaries);
        eventLogger.logStageCompleted("directly-follows", directlyFollows.size(), started);

        started = eventLogger.logStageStarted("footprint");
        FootprintMatrix footprint = footprintBuilder.build(directlyFollows);
        eventLogger.logStageCompleted("footprint", footprint.getActivities().size(), started);

        int activityCount = footprint.getActivities().size();
        if (activityCount > parameters.getMaxActivities()) {
            eventLogger.logLimitExceeded("independent-sets", activityCount, parameters.getMaxActivities());
        }

        started = eventLogger.logStageStarted("independent-sets");
        List<ActivitySet> independentSets = independentSetEnumerator.enumerate(footprint);
        eventLogger.logStageCompleted("independent-sets", independentSets.size(), started);

        started = eventLogger.logStageStarted("transitions");
        List<Transition> transitions = transitionDiscoverer.discover(footprint, independentSets);
        eventLogger.logStageCompleted("transitions", transitions.size(), started);

        started = eventLogger.logStageStarted("maximal-sets");
        List<Transition> maximalTransitions = maximalSetFilter.filter(transitions);
        eventLogger.logStageCompleted("maximal-sets", maximalTransitions.size(), started);

        DiscoveryResult result = new DiscoveryResult(eventLogger.getRunId(), filtered, boundaries,
            directlyFollows, footprint, independentSets, transitions, maximalTransitions,
            eventLogger.getEventHistory());
        logger.info(result);
        if (logger.isDebugEnabled()) {
            for (StageEvent stage : eventLogger.getCompletedStages()) {
                logger.debug(stage);
            }
        }
        return result;
    }

    private static DiscoveryEventLogger newRunLogger() {
        return new DiscoveryEventLogger(UUID.randomUUID().toString().substring(0, 8));
    }

    public MinerParameters getParameters() {
        return parameters;
    }
}

package org.alphaminer.discovery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.alphaminer.logger.DiscoveryEventLogger.StageEvent;
import org.alphaminer.model.ActivitySet;
import org.alphaminer.model.Boundaries;
import org.alphaminer.model.DirectlyFollowsRelation;
import org.alphaminer.model.FootprintMatrix;
import org.alphaminer.model.Transition;
import org.alphaminer.model.TraceDictionary;

/**
 * Everything one discovery run produced, stage by stage.
 */
public final class DiscoveryResult {

    private final String runId;
    private final TraceDictionary traceDictionary;
    private final Boundaries boundaries;
    private final DirectlyFollowsRelation directlyFollows;
    private final FootprintMatrix footprint;
    private final List<ActivitySet> independentSets;
    private final List<Transition> transitions;
    private final List<Transition> maximalTransitions;
    private final List<StageEvent> stageEvents;

    public DiscoveryResult(String runId, TraceDictionary traceDictionary, Boundaries boundaries,
                           DirectlyFollowsRelation directlyFollows, FootprintMatrix footprint,
                           List<ActivitySet> independentSets, List<Transition> transitions,
                           List<Transition> maximalTransitions, List<StageEvent> stageEvents) {
        this.runId = runId;
        this.traceDictionary = traceDictionary;
        this.boundaries = boundaries;
        this.directlyFollows = directlyFollows;
        this.footprint = footprint;
        this.independentSets = Collections.unmodifiableList(new ArrayList<>(independentSets));
        this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
        this.maximalTransitions = Collections.unmodifiableList(new ArrayList<>(maximalTransitions));
        this.stageEvents = Collections.unmodifiableList(new ArrayList<>(stageEvents));
    }

    public String getRunId() { return runId; }

    /**
     * Traces the derived structures were computed from, after the frequency threshold
     */
    public TraceDictionary getTraceDictionary() { return traceDictionary; }

    public Boundaries getBoundaries() { return boundaries; }
    public DirectlyFollowsRelation getDirectlyFollows() { return directlyFollows; }
    public FootprintMatrix getFootprint() { return footprint; }
    public List<ActivitySet> getIndependentSets() { return independentSets; }

    /**
     * All transitions, before maximal-set filtering
     */
    public List<Transition> getTransitions() { return transitions; }

    public List<Transition> getMaximalTransitions() { return maximalTransitions; }
    public List<StageEvent> getStageEvents() { return stageEvents; }

    @Override
    public String toString() {
        return String.format("DiscoveryResult[run=%s, traces=%d, activities=%d, independentSets=%d, "
            + "transitions=%d, maximal=%d]",
            runId, traceDictionary.size(), footprint.getActivities().size(), independentSets.size(),
            transitions.size(), maximalTransitions.size());
    }
}

package org.alphaminer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

import org.alphaminer.constants.MinerConstants;

/**
 * Activities that open and close at least one trace, plus the node list of the log
 * ({@code start}, activities in first-seen order, {@code end}).
 */
public final class Boundaries {

    private final SortedSet<String> initialActivities;
    private final SortedSet<String> finalActivities;
    private final List<String> nodes;

    public Boundaries(SortedSet<String> initialActivities, SortedSet<String> finalActivities, List<String> nodes) {
        this.initialActivities = Collections.unmodifiableSortedSet(
            new TreeSet<>(Objects.requireNonNull(initialActivities, "initialActivities cannot be null")));
        this.finalActivities = Collections.unmodifiableSortedSet(
            new TreeSet<>(Objects.requireNonNull(finalActivities, "finalActivities cannot be null")));
        this.nodes = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(nodes, "nodes cannot be null")));
    }

    public SortedSet<String> getInitialActivities() {
        return initialActivities;
    }

    public SortedSet<String> getFinalActivities() {
        return finalActivities;
    }

    /**
     * Every node of the log, boundary markers included
     */
    public List<String> getNodes() {
        return nodes;
    }

    /**
     * Nodes without the boundary markers
     */
    public List<String> getActivities() {
        List<String> activities = new ArrayList<>();
        for (String node : nodes) {
            if (!MinerConstants.isReserved(node)) {
                activities.add(node);
            }
        }
        return activities;
    }

    @Override
    public String toString() {
        return "Boundaries[initial=" + initialActivities + ", final=" + finalActivities + "]";
    }
}

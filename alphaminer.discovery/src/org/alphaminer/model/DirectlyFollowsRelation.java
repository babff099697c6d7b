package org.alphaminer.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

import org.alphaminer.constants.MinerConstants;

/**
 * Case-weighted counts of immediate successions between activities, including the edges
 * leaving {@code start} and entering {@code end}. Edges iterate in pair order.
 */
public final class DirectlyFollowsRelation {

    private final SortedMap<ActivityPair, Long> edges;

    public DirectlyFollowsRelation(Map<ActivityPair, Long> edges) {
        Objects.requireNonNull(edges, "edges cannot be null");
        this.edges = Collections.unmodifiableSortedMap(new TreeMap<>(edges));
    }

    public SortedMap<ActivityPair, Long> asMap() {
        return edges;
    }

    public boolean contains(String source, String target) {
        return edges.containsKey(new ActivityPair(source, target));
    }

    /**
     * @return count of the edge, 0 when it was never observed
     */
    public long count(String source, String target) {
        Long count = edges.get(new ActivityPair(source, target));
        return count != null ? count : 0L;
    }

    /**
     * Real activities appearing on either side of any edge, boundary markers excluded
     */
    public Set<String> activities() {
        Set<String> activities = new TreeSet<>();
        for (ActivityPair pair : edges.keySet()) {
            if (!MinerConstants.isReserved(pair.source)) {
                activities.add(pair.source);
            }
            if (!MinerConstants.isReserved(pair.target)) {
                activities.add(pair.target);
            }
        }
        return Collections.unmodifiableSet(activities);
    }

    /**
     * Edges whose count reaches the given minimum, for graph views
     */
    public SortedMap<ActivityPair, Long> edgesWithMinimumCount(long minimumCount) {
        SortedMap<ActivityPair, Long> filtered = new TreeMap<>();
        for (Map.Entry<ActivityPair, Long> edge : edges.entrySet()) {
            if (edge.getValue() >= minimumCount) {
                filtered.put(edge.getKey(), edge.getValue());
            }
        }
        return Collections.unmodifiableSortedMap(filtered);
    }

    public boolean isEmpty() {
        return edges.isEmpty();
    }

    public int size() {
        return edges.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DirectlyFollowsRelation)) return false;
        return edges.equals(((DirectlyFollowsRelation) o).edges);
    }

    @Override
    public int hashCode() {
        return edges.hashCode();
    }

    @Override
    public String toString() {
        return "DirectlyFollows" + edges;
    }
}

package org.alphaminer.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Relation between every ordered pair of real activities. Consistent by construction:
 * {@code relation(a,b)} is always the inverse of {@code relation(b,a)}.
 */
public final class FootprintMatrix {

    private final SortedSet<String> activities;
    private final SortedMap<ActivityPair, Relation> cells;

    public FootprintMatrix(Map<ActivityPair, Relation> cells) {
        Objects.requireNonNull(cells, "cells cannot be null");
        SortedSet<String> collected = new TreeSet<>();
        for (ActivityPair pair : cells.keySet()) {
            collected.add(pair.source);
            collected.add(pair.target);
        }
        this.activities = Collections.unmodifiableSortedSet(collected);
        this.cells = Collections.unmodifiableSortedMap(new TreeMap<>(cells));
    }

    public SortedSet<String> getActivities() {
        return activities;
    }

    public SortedMap<ActivityPair, Relation> asMap() {
        return cells;
    }

    /**
     * @return the relation of the pair, or null when either activity is unknown
     */
    public Relation relation(String a, String b) {
        return cells.get(new ActivityPair(a, b));
    }

    /**
     * Relation between two sets of activities: the symbol shared by every cross pair (a in from, b in to),
     * or null when the cross pairs disagree or involve an unknown activity.
     */
    public Relation relation(ActivitySet from, ActivitySet to) {
        Relation shared = null;
        for (String a : from) {
            for (String b : to) {
                Relation current = relation(a, b);
                if (current == null || (shared != null && shared != current)) {
                    return null;
                }
                shared = current;
            }
        }
        return shared;
    }

    /**
     * True when every pair of distinct members is {@link Relation#INDEPENDENT}
     */
    public boolean isIndependent(ActivitySet set) {
        for (String a : set) {
            for (String b : set) {
                if (!a.equals(b) && relation(a, b) != Relation.INDEPENDENT) {
                    return false;
                }
            }
        }
        return true;
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FootprintMatrix)) return false;
        return cells.equals(((FootprintMatrix) o).cells);
    }

    @Override
    public int hashCode() {
        return cells.hashCode();
    }

    /**
     * Tabular form, one row per activity
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        int width = 4;
        for (String activity : activities) {
            width = Math.max(width, activity.length() + 1);
        }
        String cellFormat = "%-" + width + "s";
        sb.append(String.format(cellFormat, ""));
        for (String column : activities) {
            sb.append(String.format(cellFormat, column));
        }
        sb.append('\n');
        for (String row : activities) {
            sb.append(String.format(cellFormat, row));
            for (String column : activities) {
                sb.append(String.format(cellFormat, relation(row, column).getSymbol()));
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}

package org.alphaminer.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered activity sequence executed by one case. Immutable and never empty.
 * Traces order lexicographically by activity, shorter prefix first.
 */
public final class Trace implements Comparable<Trace> {

    private final List<String> activities;

    public Trace(List<String> activities) {
        Objects.requireNonNull(activities, "activities cannot be null");
        if (activities.isEmpty()) {
            throw new IllegalArgumentException("A trace holds at least one activity");
        }
        this.activities = Collections.unmodifiableList(new ArrayList<>(activities));
    }

    public static Trace of(String... activities) {
        return new Trace(Arrays.asList(activities));
    }

    public List<String> getActivities() {
        return activities;
    }

    public String first() {
        return activities.get(0);
    }

    public String last() {
        return activities.get(activities.size() - 1);
    }

    public int length() {
        return activities.size();
    }

    public String get(int index) {
        return activities.get(index);
    }

    @Override
    public int compareTo(Trace other) {
        int common = Math.min(activities.size(), other.activities.size());
        for (int i = 0; i < common; i++) {
            int c = activities.get(i).compareTo(other.activities.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(activities.size(), other.activities.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Trace)) return false;
        return activities.equals(((Trace) o).activities);
    }

    @Override
    public int hashCode() {
        return activities.hashCode();
    }

    /**
     * Printable form, e.g. {@code <a,b,c>}
     */
    @Override
    public String toString() {
        return "<" + String.join(",", activities) + ">";
    }
}

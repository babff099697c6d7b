package org.alphaminer.model;

import java.util.Objects;

/**
 * Ordered pair of activities (source first). Pairs order by source, then target.
 */
public final class ActivityPair implements Comparable<ActivityPair> {
    public final String source;
    public final String target;

    public ActivityPair(String source, String target) {
        this.source = Objects.requireNonNull(source, "source cannot be null");
        this.target = Objects.requireNonNull(target, "target cannot be null");
    }

    public static ActivityPair of(String source, String target) {
        return new ActivityPair(source, target);
    }

    @Override
    public int compareTo(ActivityPair other) {
        int c = source.compareTo(other.source);
        return c != 0 ? c : target.compareTo(other.target);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ActivityPair)) return false;
        ActivityPair other = (ActivityPair) o;
        return source.equals(other.source) && target.equals(other.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target);
    }

    @Override
    public String toString() {
        return "(" + source + "," + target + ")";
    }
}

package org.alphaminer.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable, non-empty set of activities. Used for independent sets (candidate places) and for
 * the input and output sides of a transition; a single activity is a singleton set.
 *
 * Sets order by size, then lexicographically by their sorted members.
 */
public final class ActivitySet implements Comparable<ActivitySet>, Iterable<String> {

    private final SortedSet<String> members;

    public ActivitySet(Collection<String> members) {
        Objects.requireNonNull(members, "members cannot be null");
        if (members.isEmpty()) {
            throw new IllegalArgumentException("An activity set holds at least one activity");
        }
        this.members = Collections.unmodifiableSortedSet(new TreeSet<>(members));
    }

    public static ActivitySet of(String... members) {
        return new ActivitySet(Arrays.asList(members));
    }

    public SortedSet<String> getMembers() {
        return members;
    }

    public int size() {
        return members.size();
    }

    public boolean contains(String activity) {
        return members.contains(activity);
    }

    public boolean isSingleton() {
        return members.size() == 1;
    }

    /**
     * Every (a, b) with a in this set and b in the other, in pair order
     */
    public Set<ActivityPair> crossPairs(ActivitySet other) {
        Set<ActivityPair> pairs = new LinkedHashSet<>();
        for (String a : members) {
            for (String b : other.members) {
                pairs.add(new ActivityPair(a, b));
            }
        }
        return pairs;
    }

    @Override
    public Iterator<String> iterator() {
        return members.iterator();
    }

    @Override
    public int compareTo(ActivitySet other) {
        if (members.size() != other.members.size()) {
            return Integer.compare(members.size(), other.members.size());
        }
        Iterator<String> mine = members.iterator();
        Iterator<String> theirs = other.members.iterator();
        while (mine.hasNext()) {
            int c = mine.next().compareTo(theirs.next());
            if (c != 0) {
                return c;
            }
        }
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ActivitySet)) return false;
        return members.equals(((ActivitySet) o).members);
    }

    @Override
    public int hashCode() {
        return members.hashCode();
    }

    /**
     * Printable form, e.g. {@code {a,d}}
     */
    @Override
    public String toString() {
        return "{" + String.join(",", members) + "}";
    }
}

package org.alphaminer.model;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;

/**
 * Candidate model transition from one independent set to another.
 * The relation is always {@link Relation#CAUSAL_FORWARD} or {@link Relation#PARALLEL}.
 */
public final class Transition implements Comparable<Transition> {
    public final ActivitySet input;
    public final ActivitySet output;
    public final Relation relation;

    public Transition(ActivitySet input, ActivitySet output, Relation relation) {
        this.input = Objects.requireNonNull(input, "input cannot be null");
        this.output = Objects.requireNonNull(output, "output cannot be null");
        this.relation = Objects.requireNonNull(relation, "relation cannot be null");
        if (relation != Relation.CAUSAL_FORWARD && relation != Relation.PARALLEL) {
            throw new IllegalArgumentException("A transition is causal-forward or parallel, not " + relation.name());
        }
    }

    /**
     * Activity pairs this transition covers: input x output
     */
    public Set<ActivityPair> coverage() {
        return Collections.unmodifiableSet(input.crossPairs(output));
    }

    /**
     * A transition joining or splitting several activities renders as a gateway, otherwise as a plain arc
     */
    public boolean isGateway() {
        return !input.isSingleton() || !output.isSingleton();
    }

    @Override
    public int compareTo(Transition other) {
        int c = input.compareTo(other.input);
        if (c != 0) {
            return c;
        }
        c = output.compareTo(other.output);
        return c != 0 ? c : relation.compareTo(other.relation);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transition)) return false;
        Transition other = (Transition) o;
        return input.equals(other.input) && output.equals(other.output) && relation == other.relation;
    }

    @Override
    public int hashCode() {
        return Objects.hash(input, output, relation);
    }

    @Override
    public String toString() {
        return input + " " + relation.getSymbol() + " " + output;
    }
}

package org.alphaminer.discovery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.alphaminer.model.ActivitySet;
import org.alphaminer.model.FootprintMatrix;
import org.alphaminer.model.Relation;
import org.alphaminer.model.Transition;
import org.apache.log4j.Logger;

/**
 * Finds transitions between pairs of distinct independent sets.
 *
 * For sets A and B the relation of every cross pair (a in A, b in B) must be the same:
 *   -->  records A --> B
 *   ||   records A || B
 *   <--  records B --> A
 * Mixed relations, or a shared {@code #}, record nothing.
 *
 * Pairs are compared in list order (A before B), which decides the orientation of parallel
 * transitions. With {@code parallel} set, the outer loop runs on a parallel stream; the
 * result is the same list either way.
 */
public class TransitionDiscoverer {

    private static final Logger logger = Logger.getLogger(TransitionDiscoverer.class);

    private final boolean parallel;

    public TransitionDiscoverer() {
        this(false);
    }

    public TransitionDiscoverer(boolean parallel) {
        this.parallel = parallel;
    }

    /**
     * @return every transition found, sorted by input set, then output set
     */
    public List<Transition> discover(FootprintMatrix footprint, List<ActivitySet> independentSets) {
        IntStream outer = IntStream.range(0, independentSets.size());
        if (parallel) {
            outer = outer.parallel();
        }

        List<Transition> transitions = outer
            .mapToObj(i -> transitionsFrom(footprint, independentSets, i))
            .flatMap(List::stream)
            .collect(Collectors.toCollection(ArrayList::new));

        Collections.sort(transitions);
        logger.debug("Discovered " + transitions.size() + " transitions between "
            + independentSets.size() + " independent sets");
        return transitions;
    }

    private static List<Transition> transitionsFrom(FootprintMatrix footprint, List<ActivitySet> independentSets,
                                                    int i) {
        List<Transition> found = new ArrayList<>();
        ActivitySet first = independentSets.get(i);
        for (int j = i + 1; j < independentSets.size(); j++) {
            ActivitySet second = independentSets.get(j);
            if (first.equals(second)) {
                continue;
            }
            Transition transition = between(footprint, first, second);
            if (transition != null) {
                found.add(transition);
            }
        }
        return found;
    }

    /**
     * Transition between two sets, or null when their cross relation does not form one
     */
    static Transition between(FootprintMatrix footprint, ActivitySet first, ActivitySet second) {
        Relation relation = footprint.relation(first, second);
        if (relation == null) {
            return null;
        }
        switch (relation) {
            case CAUSAL_FORWARD:
            case PARALLEL:
                return new Transition(first, second, relation);
            case CAUSAL_BACKWARD:
                return new Transition(second, first, Relation.CAUSAL_FORWARD);
            default:
                return null;
        }
    }
}

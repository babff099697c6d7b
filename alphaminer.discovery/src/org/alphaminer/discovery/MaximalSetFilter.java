package org.alphaminer.discovery;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.alphaminer.model.ActivityPair;
import org.alphaminer.model.Transition;
import org.apache.log4j.Logger;

/**
 * Keeps only transitions whose covered activity pairs (input x output) are not strictly
 * contained in the coverage of another transition.
 *
 * An index from each pair to the transitions covering it limits the comparisons: any transition
 * that dominates T must cover T's first pair, so only that pair's bucket is scanned.
 */
public class MaximalSetFilter {

    private static final Logger logger = Logger.getLogger(MaximalSetFilter.class);

    /**
     * @return the non-dominated transitions, in input order, without duplicates
     */
    public List<Transition> filter(List<Transition> transitions) {
        Set<Transition> distinct = new LinkedHashSet<>(transitions);

        Map<Transition, Set<ActivityPair>> coverage = new HashMap<>();
        Map<ActivityPair, List<Transition>> coveringTransitions = new HashMap<>();
        for (Transition transition : distinct) {
            Set<ActivityPair> pairs = transition.coverage();
            coverage.put(transition, pairs);
            for (ActivityPair pair : pairs) {
                coveringTransitions.computeIfAbsent(pair, k -> new ArrayList<>()).add(transition);
            }
        }

        List<Transition> maximal = new ArrayList<>();
        for (Transition transition : distinct) {
            if (isDominated(transition, coverage, coveringTransitions)) {
                logger.debug("Discarding dominated transition " + transition);
            } else {
                maximal.add(transition);
            }
        }
        return maximal;
    }

    private static boolean isDominated(Transition transition, Map<Transition, Set<ActivityPair>> coverage,
                                       Map<ActivityPair, List<Transition>> coveringTransitions) {
        Set<ActivityPair> own = coverage.get(transition);
        ActivityPair anyPair = own.iterator().next();
        for (Transition candidate : coveringTransitions.get(anyPair)) {
            if (candidate.equals(transition)) {
                continue;
            }
            Set<ActivityPair> other = coverage.get(candidate);
            if (other.size() > own.size() && other.containsAll(own)) {
                return true;
            }
        }
        return false;
    }
}

package org.alphaminer.discovery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.alphaminer.model.ActivitySet;
import org.alphaminer.model.FootprintMatrix;
import org.alphaminer.model.Relation;
import org.apache.log4j.Logger;

/**
 * Enumerates every non-empty set of activities whose members are pairwise independent.
 *
 * <p>Depth-first backtracking over the sorted activities. Each search state holds the current
 * candidate set and the activities that may still extend it: those after the last member in
 * sort order and independent of every member. A branch ends when nothing is eligible, so invalid
 * subsets are never built.</p>
 *
 * <pre>
 *   activities a,b,c,d,e with a#d, b#e, c#e
 *
 *        {a}      {b}     {c}    {d}   {e}
 *         |        |       |
 *       {a,d}    {b,e}   {c,e}
 * </pre>
 *
 * <p>All sets are returned, not just the maximal ones: smaller sets are still place candidates.
 * The cost is exponential in the number of activities in the worst case (no causal or parallel
 * pairs at all).</p>
 */
public class IndependentSetEnumerator {

    private static final Logger logger = Logger.getLogger(IndependentSetEnumerator.class);

    /**
     * @return independent sets ordered by size, then members
     */
    public List<ActivitySet> enumerate(FootprintMatrix footprint) {
        List<String> activities = new ArrayList<>(footprint.getActivities());
        List<ActivitySet> independentSets = new ArrayList<>();

        extend(footprint, new ArrayList<>(), activities, independentSets);

        Collections.sort(independentSets);
        logger.debug("Enumerated " + independentSets.size() + " independent sets over "
            + activities.size() + " activities");
        return independentSets;
    }

    private void extend(FootprintMatrix footprint, List<String> members, List<String> eligible,
                        List<ActivitySet> found) {
        for (int i = 0; i < eligible.size(); i++) {
            String next = eligible.get(i);
            members.add(next);
            found.add(new ActivitySet(members));

            // Prune: only later activities independent of the new member stay eligible
            List<String> remaining = new ArrayList<>();
            for (int j = i + 1; j < eligible.size(); j++) {
                String candidate = eligible.get(j);
                if (isIndependent(footprint, next, candidate)) {
                    remaining.add(candidate);
                }
            }
            if (!remaining.isEmpty()) {
                extend(footprint, members, remaining, found);
            }
            members.remove(members.size() - 1);
        }
    }

    private static boolean isIndependent(FootprintMatrix footprint, String a, String b) {
        return footprint.relation(a, b) == Relation.INDEPENDENT
            && footprint.relation(b, a) == Relation.INDEPENDENT;
    }
}

package org.alphaminer.discovery;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.alphaminer.model.ActivityPair;
import org.alphaminer.model.ActivitySet;
import org.alphaminer.model.FootprintMatrix;
import org.alphaminer.model.Relation;
import org.alphaminer.model.Transition;
import org.junit.jupiter.api.Test;

public class TransitionDiscovererTest {

    private static FootprintMatrix workedExampleMatrix() throws Exception {
        return new AlphaMiner().discover(DiscoveryFixtures.workedExample()).getFootprint();
    }

    @Test
    public void testWorkedExample() throws Exception {
        FootprintMatrix footprint = workedExampleMatrix();
        List<ActivitySet> sets = new IndependentSetEnumerator().enumerate(footprint);

        List<Transition> transitions = new TransitionDiscoverer().discover(footprint, sets);

        assertEquals(Arrays.asList(
            "{a} --> {b}", "{a} --> {c}", "{a} --> {e}", "{a} --> {b,e}", "{a} --> {c,e}",
            "{b} || {c}", "{b} --> {d}", "{c} --> {d}", "{e} --> {d}",
            "{b,e} --> {d}", "{c,e} --> {d}"),
            DiscoveryFixtures.printedTransitions(transitions));
    }

    @Test
    public void testBackwardRelationIsReversed() throws Exception {
        FootprintMatrix footprint = workedExampleMatrix();

        Transition transition = TransitionDiscoverer.between(footprint, ActivitySet.of("d"), ActivitySet.of("c", "e"));

        assertEquals(new Transition(ActivitySet.of("c", "e"), ActivitySet.of("d"), Relation.CAUSAL_FORWARD), transition);
    }

    @Test
    public void testMixedOrIndependentRelationsGiveNothing() throws Exception {
        FootprintMatrix footprint = workedExampleMatrix();

        // a --> b but a # d
        assertNull(TransitionDiscoverer.between(footprint, ActivitySet.of("a"), ActivitySet.of("b", "d")));
        // a # d
        assertNull(TransitionDiscoverer.between(footprint, ActivitySet.of("a"), ActivitySet.of("d")));
        // overlapping sets share the a # a cell
        assertNull(TransitionDiscoverer.between(footprint, ActivitySet.of("a"), ActivitySet.of("a", "d")));
    }

    @Test
    public void testParallelEvaluationGivesSameList() throws Exception {
        Map<ActivityPair, Relation> cells = new HashMap<>();
        List<String> activities = Arrays.asList("a", "b", "c", "d", "e", "f", "g", "h");
        for (String x : activities) {
            for (String y : activities) {
                Relation relation;
                if (x.equals(y)) {
                    relation = Relation.INDEPENDENT;
                } else if ((x.charAt(0) - 'a') / 2 + 1 == (y.charAt(0) - 'a') / 2) {
                    relation = Relation.CAUSAL_FORWARD;
                } else if ((y.charAt(0) - 'a') / 2 + 1 == (x.charAt(0) - 'a') / 2) {
                    relation = Relation.CAUSAL_BACKWARD;
                } else {
                    relation = Relation.INDEPENDENT;
                }
                cells.put(ActivityPair.of(x, y), relation);
            }
        }
        FootprintMatrix footprint = new FootprintMatrix(cells);
        List<ActivitySet> sets = new IndependentSetEnumerator().enumerate(footprint);

        List<Transition> sequential = new TransitionDiscoverer(false).discover(footprint, sets);
        List<Transition> parallel = new TransitionDiscoverer(true).discover(footprint, sets);

        assertFalse(sequential.isEmpty());
        assertEquals(sequential, parallel);
    }

    @Test
    public void testNoIndependentSetsGiveNoTransitions() {
        FootprintMatrix empty = new FootprintMatrix(Collections.emptyMap());

        assertTrue(new TransitionDiscoverer().discover(empty, Collections.emptyList()).isEmpty());
    }
}

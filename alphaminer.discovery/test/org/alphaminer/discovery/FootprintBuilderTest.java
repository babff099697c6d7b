package org.alphaminer.discovery;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.TreeSet;

import org.alphaminer.model.ActivitySet;
import org.alphaminer.model.DirectlyFollowsRelation;
import org.alphaminer.model.FootprintMatrix;
import org.alphaminer.model.Relation;
import org.alphaminer.model.Trace;
import org.alphaminer.model.TraceDictionary;
import org.junit.jupiter.api.Test;

public class FootprintBuilderTest {

    private static FootprintMatrix footprint(TraceDictionary dictionary) throws Exception {
        DirectlyFollowsRelation relation = new DirectlyFollowsBuilder()
            .build(dictionary, new BoundaryIdentifier().identify(dictionary));
        return new FootprintBuilder().build(relation);
    }

    @Test
    public void testWorkedExample() throws Exception {
        FootprintMatrix matrix = footprint(DiscoveryFixtures.workedExample());

        assertEquals(new TreeSet<>(Arrays.asList("a", "b", "c", "d", "e")), matrix.getActivities());
        assertEquals(Relation.PARALLEL, matrix.relation("b", "c"));
        assertEquals(Relation.INDEPENDENT, matrix.relation("a", "d"));
        assertEquals(Relation.INDEPENDENT, matrix.relation("b", "e"));
        assertEquals(Relation.INDEPENDENT, matrix.relation("c", "e"));
        assertEquals(Relation.CAUSAL_FORWARD, matrix.relation("a", "b"));
        assertEquals(Relation.CAUSAL_FORWARD, matrix.relation("c", "d"));
        assertEquals(Relation.CAUSAL_FORWARD, matrix.relation("e", "d"));
        assertEquals(Relation.CAUSAL_BACKWARD, matrix.relation("d", "e"));
        assertEquals(Relation.INDEPENDENT, matrix.relation("a", "a"));
        assertEquals(25, matrix.asMap().size());
    }

    @Test
    public void testBoundaryMarkersAreNotActivities() throws Exception {
        FootprintMatrix matrix = footprint(DiscoveryFixtures.workedExample());

        assertNull(matrix.relation("start", "a"));
        assertNull(matrix.relation("d", "end"));
    }

    @Test
    public void testSelfLoopIsParallel() throws Exception {
        FootprintMatrix matrix = footprint(TraceDictionary.builder()
            .addCount(Trace.of("a", "b", "b", "c"), 1)
            .build());

        assertEquals(Relation.PARALLEL, matrix.relation("b", "b"));
        assertEquals(Relation.INDEPENDENT, matrix.relation("a", "a"));
        assertEquals(Relation.CAUSAL_FORWARD, matrix.relation("b", "c"));
    }

    @Test
    public void testMatrixIsConsistent() throws Exception {
        FootprintMatrix matrix = footprint(TraceDictionary.builder()
            .addCount(Trace.of("a", "b", "c", "a", "d"), 2)
            .addCount(Trace.of("d", "c", "b", "e"), 1)
            .addCount(Trace.of("e", "e", "a"), 4)
            .build());

        for (String a : matrix.getActivities()) {
            for (String b : matrix.getActivities()) {
                Relation forward = matrix.relation(a, b);
                Relation backward = matrix.relation(b, a);
                assertNotNull(forward);
                assertEquals(forward.inverse(), backward, "relation(" + a + "," + b + ")");
            }
        }
    }

    @Test
    public void testRelationBetweenSets() throws Exception {
        FootprintMatrix matrix = footprint(DiscoveryFixtures.workedExample());

        assertEquals(Relation.CAUSAL_FORWARD,
            matrix.relation(ActivitySet.of("a"), ActivitySet.of("b", "e")));
        assertNull(matrix.relation(ActivitySet.of("a"), ActivitySet.of("b", "d")));
    }

    @Test
    public void testEmptyRelationGivesEmptyMatrix() {
        FootprintMatrix matrix = new FootprintBuilder()
            .build(new DirectlyFollowsRelation(Collections.emptyMap()));

        assertTrue(matrix.isEmpty());
        assertTrue(matrix.getActivities().isEmpty());
    }
}

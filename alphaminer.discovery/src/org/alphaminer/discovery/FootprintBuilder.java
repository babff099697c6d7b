package org.alphaminer.discovery;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import org.alphaminer.model.ActivityPair;
import org.alphaminer.model.DirectlyFollowsRelation;
import org.alphaminer.model.FootprintMatrix;
import org.alphaminer.model.Relation;

/**
 * Classifies every ordered pair of real activities from the directly-follows relation.
 *
 * A self-loop (a directly followed by a) is reported as {@link Relation#PARALLEL}; the footprint has
 * no separate loop symbol. Only direct adjacency counts: activities that are always ordered but
 * never adjacent are {@link Relation#INDEPENDENT}.
 */
public class FootprintBuilder {

    public FootprintMatrix build(DirectlyFollowsRelation directlyFollows) {
        Set<String> activities = directlyFollows.activities();
        Map<ActivityPair, Relation> cells = new HashMap<>();

        for (String a : activities) {
            for (String b : activities) {
                cells.put(new ActivityPair(a, b), classify(directlyFollows, a, b));
            }
        }
        return new FootprintMatrix(cells);
    }

    static Relation classify(DirectlyFollowsRelation directlyFollows, String a, String b) {
        boolean forward = directlyFollows.contains(a, b);
        if (a.equals(b)) {
            return forward ? Relation.PARALLEL : Relation.INDEPENDENT;
        }
        boolean backward = directlyFollows.contains(b, a);
        if (forward && backward) {
            return Relation.PARALLEL;
        } else if (forward) {
            return Relation.CAUSAL_FORWARD;
        } else if (backward) {
            return Relation.CAUSAL_BACKWARD;
        }
        return Relation.INDEPENDENT;
    }
}

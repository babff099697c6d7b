package org.alphaminer.discovery;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import org.alphaminer.constants.MinerConstants;
import org.alphaminer.model.Boundaries;
import org.alphaminer.model.Trace;
import org.alphaminer.model.TraceDictionary;

/**
 * Finds the activities that open and close the traces of a dictionary.
 */
public class BoundaryIdentifier {

    public Boundaries identify(TraceDictionary dictionary) {
        SortedSet<String> initialActivities = new TreeSet<>();
        SortedSet<String> finalActivities = new TreeSet<>();
        Set<String> seen = new LinkedHashSet<>();

        for (Trace trace : dictionary.traces()) {
            initialActivities.add(trace.first());
            finalActivities.add(trace.last());
            seen.addAll(trace.getActivities());
        }

        List<String> nodes = new ArrayList<>();
        if (!seen.isEmpty()) {
            nodes.add(MinerConstants.START);
            nodes.addAll(seen);
            nodes.add(MinerConstants.END);
        }
        return new Boundaries(initialActivities, finalActivities, nodes);
    }
}

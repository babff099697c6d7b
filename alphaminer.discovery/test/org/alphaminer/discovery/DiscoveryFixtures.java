package org.alphaminer.discovery;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.alphaminer.model.ActivitySet;
import org.alphaminer.model.Trace;
import org.alphaminer.model.TraceDictionary;
import org.alphaminer.model.Transition;

/**
 * Shared inputs for the discovery tests.
 */
final class DiscoveryFixtures {

    private DiscoveryFixtures() {
    }

    /**
     * (a,b,c,d):3, (a,c,b,d):2, (a,e,d):1 over 6 cases
     */
    static TraceDictionary workedExample() {
        return TraceDictionary.builder()
            .addCount(Trace.of("a", "b", "c", "d"), 3)
            .addCount(Trace.of("a", "c", "b", "d"), 2)
            .addCount(Trace.of("a", "e", "d"), 1)
            .build();
    }

    static List<ActivitySet> sets(ActivitySet... sets) {
        return new ArrayList<>(Arrays.asList(sets));
    }

    static List<String> printed(List<?> values) {
        List<String> printed = new ArrayList<>();
        for (Object value : values) {
            printed.add(value.toString());
        }
        return printed;
    }

    static List<String> printedTransitions(List<Transition> transitions) {
        return printed(transitions);
    }
}

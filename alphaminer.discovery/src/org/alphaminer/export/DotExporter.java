package org.alphaminer.export;

import java.util.Map;

import org.alphaminer.constants.MinerConstants;
import org.alphaminer.discovery.DiscoveryResult;
import org.alphaminer.model.ActivityPair;
import org.alphaminer.model.Relation;
import org.alphaminer.model.Transition;

/**
 * Exports discovery results to Graphviz DOT text
 */
public class DotExporter {

    /**
     * Directly-follows graph: one ellipse per node, one edge per pair labelled with its count.
     * Edges below the minimum count are left out; their nodes stay.
     */
    public static String exportDirectlyFollows(DiscoveryResult result, long minimumCount) {
        StringBuilder dot = new StringBuilder();
        dot.append("digraph DirectlyFollows {\n");
        dot.append("  graph [fontname=\"Helvetica\", fontsize=15];\n");
        dot.append("  node [shape=ellipse, style=filled, fillcolor=lightblue, fontsize=12];\n\n");

        for (String node : result.getBoundaries().getNodes()) {
            dot.append(String.format("  %s;\n", quote(node)));
        }
        dot.append('\n');

        for (Map.Entry<ActivityPair, Long> edge : result.getDirectlyFollows().edgesWithMinimumCount(minimumCount).entrySet()) {
            dot.append(String.format("  %s -> %s [label=\"%d\", fontsize=10];\n",
                quote(edge.getKey().source), quote(edge.getKey().target), edge.getValue()));
        }

        dot.append("}\n");
        return dot.toString();
    }

    /**
     * Discovered process: activities as boxes, start and end as circles, and one connector per
     * maximal transition ("x" for causal, "+" for parallel) joining its input and output activities.
     */
    public static String exportProcess(DiscoveryResult result) {
        StringBuilder dot = new StringBuilder();
        dot.append("digraph Process {\n");
        dot.append("  rankdir=LR;\n");
        dot.append("  node [shape=rect, style=filled, color=black, fillcolor=white];\n\n");

        dot.append("  // Activities\n");
        for (String activity : result.getBoundaries().getActivities()) {
            dot.append(String.format("  %s;\n", quote(activity)));
        }

        dot.append("\n  // Transitions\n");
        int index = 0;
        for (Transition transition : result.getMaximalTransitions()) {
            String connectorId = quote((transition.relation == Relation.PARALLEL ? "gateway_" : "transition_") + index++);
            String label = transition.relation == Relation.PARALLEL ? "+" : "x";
            dot.append(String.format("  %s [shape=circle, label=\"%s\", fillcolor=lightgrey];\n", connectorId, label));
            String arcStyle = transition.relation == Relation.PARALLEL ? " [dir=none]" : "";
            for (String source : transition.input) {
                dot.append(String.format("  %s -> %s%s;\n", quote(source), connectorId, arcStyle));
            }
            for (String target : transition.output) {
                dot.append(String.format("  %s -> %s%s;\n", connectorId, quote(target), arcStyle));
            }
        }

        if (!result.getBoundaries().getInitialActivities().isEmpty()) {
            dot.append("\n  // Boundaries\n");
            dot.append(String.format("  %s [shape=circle];\n", quote(MinerConstants.START)));
            dot.append(String.format("  %s [shape=circle, penwidth=3];\n", quote(MinerConstants.END)));
            for (String initial : result.getBoundaries().getInitialActivities()) {
                dot.append(String.format("  %s -> %s;\n", quote(MinerConstants.START), quote(initial)));
            }
            for (String last : result.getBoundaries().getFinalActivities()) {
                dot.append(String.format("  %s -> %s;\n", quote(last), quote(MinerConstants.END)));
            }
        }

        dot.append("}\n");
        return dot.toString();
    }

    private static String quote(String id) {
        // DOT quoted ids only need quotes and backslashes escaped
        return "\"" + id.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}

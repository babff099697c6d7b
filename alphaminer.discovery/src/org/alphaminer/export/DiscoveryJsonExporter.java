package org.alphaminer.export;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.alphaminer.discovery.DiscoveryResult;
import org.alphaminer.json.JsonDocument;
import org.alphaminer.logger.DiscoveryEventLogger.StageEvent;
import org.alphaminer.model.ActivityPair;
import org.alphaminer.model.ActivitySet;
import org.alphaminer.model.Relation;
import org.alphaminer.model.Trace;
import org.alphaminer.model.TraceStatistics;
import org.alphaminer.model.Transition;
import org.apache.log4j.Logger;
import org.json.simple.JSONArray;

/**
 * Serialises a discovery result as one JSON document for external viewers.
 *
 * <pre>
 * {
 *   "run_id": "1a2b3c4d",
 *   "traces": [ {"trace": ["a","b"], "count": 3, "frequency": 0.5}, ... ],
 *   "initial_activities": ["a"], "final_activities": ["d"], "nodes": ["start","a",...,"end"],
 *   "directly_follows": [ {"source": "start", "target": "a", "count": 6}, ... ],
 *   "footprint": { "activities": [...], "matrix": [ ["#","-->",...], ... ] },
 *   "independent_sets": [ ["a"], ["a","d"], ... ],
 *   "transitions": [ {"input": ["a"], "output": ["b"], "relation": "-->", "gateway": false}, ... ],
 *   "maximal_transitions": [ ... ],
 *   "stages": [ {"stage": "footprint", "size": 5, "elapsed_ms": 0}, ... ]
 * }
 * </pre>
 */
public class DiscoveryJsonExporter {

    private static final Logger logger = Logger.getLogger(DiscoveryJsonExporter.class);

    @SuppressWarnings("unchecked")
    public JsonDocument toJson(DiscoveryResult result) {
        JsonDocument document = new JsonDocument();
        document.put("run_id", result.getRunId());

        List<JsonDocument> traces = new ArrayList<>();
        for (Map.Entry<Trace, TraceStatistics> entry : result.getTraceDictionary().asMap().entrySet()) {
            traces.add(new JsonDocument()
                .putArray("trace", JsonDocument.toArray(entry.getKey().getActivities()))
                .put("count", (long) entry.getValue().count)
                .put("frequency", entry.getValue().frequency));
        }
        document.putObjects("traces", traces);

        document.putArray("initial_activities", JsonDocument.toArray(result.getBoundaries().getInitialActivities()));
        document.putArray("final_activities", JsonDocument.toArray(result.getBoundaries().getFinalActivities()));
        document.putArray("nodes", JsonDocument.toArray(result.getBoundaries().getNodes()));

        List<JsonDocument> edges = new ArrayList<>();
        for (Map.Entry<ActivityPair, Long> edge : result.getDirectlyFollows().asMap().entrySet()) {
            edges.add(new JsonDocument()
                .put("source", edge.getKey().source)
                .put("target", edge.getKey().target)
                .put("count", edge.getValue()));
        }
        document.putObjects("directly_follows", edges);

        JSONArray matrix = new JSONArray();
        for (String row : result.getFootprint().getActivities()) {
            JSONArray cells = new JSONArray();
            for (String column : result.getFootprint().getActivities()) {
                Relation relation = result.getFootprint().relation(row, column);
                cells.add(relation.getSymbol());
            }
            matrix.add(cells);
        }
        document.putObject("footprint", new JsonDocument()
            .putArray("activities", JsonDocument.toArray(result.getFootprint().getActivities()))
            .putArray("matrix", matrix));

        List<List<String>> independentSets = new ArrayList<>();
        for (ActivitySet set : result.getIndependentSets()) {
            independentSets.add(new ArrayList<>(set.getMembers()));
        }
        document.putArray("independent_sets", JsonDocument.toNestedArray(independentSets));

        document.putObjects("transitions", transitionsToJson(result.getTransitions()));
        document.putObjects("maximal_transitions", transitionsToJson(result.getMaximalTransitions()));

        List<JsonDocument> stages = new ArrayList<>();
        for (StageEvent event : result.getStageEvents()) {
            stages.add(new JsonDocument()
                .put("event", event.getEventType())
                .put("stage", event.getStage())
                .put("size", (long) event.getSize())
                .put("elapsed_ms", event.getElapsedMillis()));
        }
        document.putObjects("stages", stages);
        return document;
    }

    public void write(DiscoveryResult result, Path file) throws IOException {
        toJson(result).saveToFile(file);
        logger.info("Discovery result " + result.getRunId() + " exported to " + file);
    }

    private static List<JsonDocument> transitionsToJson(List<Transition> transitions) {
        List<JsonDocument> documents = new ArrayList<>();
        for (Transition transition : transitions) {
            documents.add(new JsonDocument()
                .putArray("input", JsonDocument.toArray(transition.input.getMembers()))
                .putArray("output", JsonDocument.toArray(transition.output.getMembers()))
                .put("relation", transition.relation.getSymbol())
                .put("gateway", transition.isGateway()));
        }
        return documents;
    }
}

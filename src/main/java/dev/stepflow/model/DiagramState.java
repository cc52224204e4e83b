package dev.stepflow.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the persistence collaborator stores for one diagram: the graph,
 * the per-step classification and both dictionaries.
 */
public record DiagramState(
    List<Step> steps,
    List<Connection> connections,
    Map<String, StepType> classifications,
    Map<String, String> stateDictionary,
    Map<String, String> ruleDictionary
) {
    public DiagramState {
        steps = List.copyOf(steps);
        connections = List.copyOf(connections);
        classifications = ordered(classifications);
        stateDictionary = ordered(stateDictionary);
        ruleDictionary = ordered(ruleDictionary);
    }

    private static <V> Map<String, V> ordered(Map<String, V> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}

package dev.stepflow.engine;

import dev.stepflow.model.Connection;
import dev.stepflow.model.Step;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Read-only index over a list of steps and connections, preserving the order
 * in which both were given.
 */
public final class StepGraph {

    public static final String QUALIFIED_NAME_SEPARATOR = " > ";

    private final Map<String, Step> steps;
    private final List<Connection> connections;
    private final Map<String, List<Connection>> outgoing;
    private final Map<String, String> qualifiedNames = new HashMap<>();

    private StepGraph(Map<String, Step> steps, List<Connection> connections) {
        this.steps = steps;
        this.connections = connections;
        this.outgoing = new HashMap<>();
        for (Connection connection : connections) {
            outgoing.computeIfAbsent(connection.fromStepId(), k -> new ArrayList<>()).add(connection);
        }
    }

    public static StepGraph of(Collection<Step> steps, Collection<Connection> connections) {
        var byId = new LinkedHashMap<String, Step>();
        for (Step step : steps) {
            byId.putIfAbsent(step.id(), step);
        }
        return new StepGraph(Collections.unmodifiableMap(byId), List.copyOf(connections));
    }

    public Collection<Step> steps() {
        return steps.values();
    }

    public List<Connection> connections() {
        return connections;
    }

    public int size() {
        return steps.size();
    }

    public Optional<Step> step(String id) {
        return Optional.ofNullable(steps.get(id));
    }

    public boolean contains(String id) {
        return steps.containsKey(id);
    }

    /** Outgoing connections of a step, in the order they were added. */
    public List<Connection> outgoing(String stepId) {
        List<Connection> result = outgoing.get(stepId);
        return result == null ? List.of() : Collections.unmodifiableList(result);
    }

    public String qualifiedName(String stepId) {
        Step step = steps.get(stepId);
        if (step == null) {
            return "";
        }
        return qualifiedNames.computeIfAbsent(stepId, id -> qualifiedName(step, steps::get));
    }

    /**
     * The step name prefixed by its ancestors' names. Stops at a missing
     * parent or at the first ancestor already seen, so a parent cycle still
     * yields a finite name.
     */
    public static String qualifiedName(Step step, Function<String, Step> lookup) {
        var names = new ArrayList<String>();
        Set<String> seen = new HashSet<>();
        Step current = step;
        while (current != null && seen.add(current.id())) {
            names.add(current.name());
            current = current.hasParent() ? lookup.apply(current.parentId()) : null;
        }
        Collections.reverse(names);
        return String.join(QUALIFIED_NAME_SEPARATOR, names);
    }
}

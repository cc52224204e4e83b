package dev.stepflow.engine;

import dev.stepflow.model.Connection;
import dev.stepflow.model.ConnectionType;
import dev.stepflow.model.Step;
import dev.stepflow.model.StepPatch;
import dev.stepflow.model.StepType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Mutable in-memory diagram: steps in insertion order plus typed connections.
 *
 * <p>Not thread-safe; the editor drives it from a single event loop.
 */
public final class StepStore {

    private static final Logger log = LoggerFactory.getLogger(StepStore.class);

    public static final Duration DEFAULT_DEBOUNCE_WINDOW = Duration.ofMillis(500);

    private final Map<String, Step> steps = new LinkedHashMap<>();
    private final List<Connection> connections = new ArrayList<>();
    private final Supplier<String> idGenerator;
    private final Clock clock;
    private final Duration debounceWindow;

    // Last addConnection call, used to swallow double-fired UI events.
    private ConnectionRequest lastConnectionRequest;

    private record ConnectionRequest(Connection connection, Instant at) {}

    public StepStore() {
        this(() -> UUID.randomUUID().toString(), Clock.systemUTC(), DEFAULT_DEBOUNCE_WINDOW);
    }

    public StepStore(Supplier<String> idGenerator, Clock clock, Duration debounceWindow) {
        this.idGenerator = idGenerator;
        this.clock = clock;
        this.debounceWindow = debounceWindow;
    }

    // --- steps ---

    public String addStep(String name) {
        return addStep(StepPatch.rename(name));
    }

    public String addStep(String name, StepType type) {
        return addStep(StepPatch.rename(name).withType(type));
    }

    public String addChildStep(String parentId, String name) {
        return addStep(StepPatch.rename(name).withParent(parentId));
    }

    /**
     * Create a step from the given fields. Unset fields take their defaults;
     * an unknown parent is dropped.
     *
     * @return the id of the new step
     */
    public String addStep(StepPatch data) {
        String id = idGenerator.get();
        Step step = Step.of(id, "").merge(data);
        if (step.hasParent() && !steps.containsKey(step.parentId())) {
            log.warn("Parent {} of new step '{}' does not exist, adding it as a root step",
                step.parentId(), step.name());
            step = step.withParent(null);
        }
        steps.put(id, step);
        log.debug("Added step {} '{}'", id, step.name());
        return id;
    }

    /**
     * Merge the patch into an existing step.
     *
     * @return false if the step is unknown or the parent change was rejected
     */
    public boolean updateStep(String id, StepPatch patch) {
        Step current = steps.get(id);
        if (current == null) {
            log.warn("Ignoring update of unknown step {}", id);
            return false;
        }
        if (patch.changesParent() && !canReparent(id, patch.parentId())) {
            return false;
        }
        steps.put(id, current.merge(patch));
        return true;
    }

    /**
     * Remove a step, every connection touching it, and the parent link of
     * its direct children.
     */
    public boolean removeStep(String id) {
        Step removed = steps.remove(id);
        if (removed == null) {
            log.warn("Ignoring removal of unknown step {}", id);
            return false;
        }
        int before = connections.size();
        connections.removeIf(connection -> connection.touches(id));
        for (Step child : List.copyOf(steps.values())) {
            if (id.equals(child.parentId())) {
                steps.put(child.id(), child.withParent(null));
            }
        }
        log.debug("Removed step {} '{}' and {} connection(s)", id, removed.name(), before - connections.size());
        return true;
    }

    public Optional<Step> findStep(String id) {
        return Optional.ofNullable(steps.get(id));
    }

    public List<Step> steps() {
        return List.copyOf(steps.values());
    }

    public String qualifiedName(String stepId) {
        Step step = steps.get(stepId);
        return step == null ? "" : qualifiedName(step);
    }

    public String qualifiedName(Step step) {
        return StepGraph.qualifiedName(step, steps::get);
    }

    private boolean canReparent(String id, String newParentId) {
        if (newParentId == null) {
            return true;
        }
        if (!steps.containsKey(newParentId)) {
            log.warn("Rejecting parent {} for step {}: no such step", newParentId, id);
            return false;
        }
        Set<String> seen = new HashSet<>();
        String cursor = newParentId;
        while (cursor != null && seen.add(cursor)) {
            if (cursor.equals(id)) {
                log.warn("Rejecting parent {} for step {}: would create a parent cycle", newParentId, id);
                return false;
            }
            Step ancestor = steps.get(cursor);
            cursor = ancestor == null ? null : ancestor.parentId();
        }
        return true;
    }

    // --- connections ---

    /**
     * Add a connection between two existing steps. Exact duplicates are
     * rejected, and a repeat of the previous call inside the debounce window
     * is ignored.
     *
     * @return true if a connection was stored
     */
    public boolean addConnection(String fromStepId, String toStepId, ConnectionType type) {
        var connection = new Connection(fromStepId, toStepId, type);
        Instant now = clock.instant();
        ConnectionRequest previous = lastConnectionRequest;
        if (previous != null
            && previous.connection().equals(connection)
            && Duration.between(previous.at(), now).compareTo(debounceWindow) < 0) {
            log.debug("Ignoring repeated connection request {} within {} ms", connection, debounceWindow.toMillis());
            return false;
        }
        lastConnectionRequest = new ConnectionRequest(connection, now);

        if (!steps.containsKey(fromStepId) || !steps.containsKey(toStepId)) {
            log.warn("Rejecting connection {}: unknown step", connection);
            return false;
        }
        if (connections.contains(connection)) {
            log.info("Rejecting duplicate connection {}", connection);
            return false;
        }
        connections.add(connection);
        return true;
    }

    /** Remove the connection matching all three fields, if any. */
    public boolean removeConnection(String fromStepId, String toStepId, ConnectionType type) {
        boolean removed = connections.remove(new Connection(fromStepId, toStepId, type));
        if (!removed) {
            log.warn("Ignoring removal of unknown connection {} -> {} ({})", fromStepId, toStepId, type.label());
        }
        return removed;
    }

    public List<Connection> connections() {
        return List.copyOf(connections);
    }

    public List<Connection> outgoing(String stepId) {
        return connections.stream()
            .filter(connection -> connection.fromStepId().equals(stepId))
            .toList();
    }

    // --- bulk ---

    public StepGraph graph() {
        return StepGraph.of(steps.values(), connections);
    }

    /**
     * Replace the whole diagram, e.g. after an import. Invalid references are
     * repaired instead of rejected: dangling parents and parent links that
     * close a cycle are cleared, connections to unknown steps and duplicates
     * are dropped.
     */
    public void replaceAll(Collection<Step> newSteps, Collection<Connection> newConnections) {
        steps.clear();
        connections.clear();
        lastConnectionRequest = null;
        for (Step step : newSteps) {
            steps.putIfAbsent(step.id(), step.withParent(null));
        }
        for (Step step : newSteps) {
            if (step.hasParent() && steps.get(step.id()).parentId() == null) {
                if (canReparent(step.id(), step.parentId())) {
                    steps.put(step.id(), steps.get(step.id()).withParent(step.parentId()));
                }
            }
        }
        for (Connection connection : newConnections) {
            if (!steps.containsKey(connection.fromStepId()) || !steps.containsKey(connection.toStepId())) {
                log.warn("Dropping connection {}: unknown step", connection);
            } else if (!connections.contains(connection)) {
                connections.add(connection);
            }
        }
        log.debug("Loaded {} step(s) and {} connection(s)", steps.size(), connections.size());
    }

    public void clear() {
        steps.clear();
        connections.clear();
        lastConnectionRequest = null;
    }
}

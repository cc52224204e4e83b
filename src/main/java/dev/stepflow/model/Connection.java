package dev.stepflow.model;

import java.util.Objects;

/**
 * A typed directed edge between two steps. Two connections are the same
 * connection when source, target and type all match.
 */
public record Connection(
    String fromStepId,
    String toStepId,
    ConnectionType type
) {
    public Connection {
        Objects.requireNonNull(fromStepId, "fromStepId");
        Objects.requireNonNull(toStepId, "toStepId");
        Objects.requireNonNull(type, "type");
    }

    public boolean touches(String stepId) {
        return fromStepId.equals(stepId) || toStepId.equals(stepId);
    }
}

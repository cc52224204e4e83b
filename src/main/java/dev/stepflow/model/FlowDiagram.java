package dev.stepflow.model;

import java.util.List;

/**
 * A diagram as handed over by the import collaborator.
 */
public record FlowDiagram(
    List<Step> steps,
    List<Connection> connections,
    List<ClassificationRule> classificationRules  // nullable when the source carries no rules
) {
    public FlowDiagram {
        steps = List.copyOf(steps);
        connections = List.copyOf(connections);
        classificationRules = classificationRules == null ? null : List.copyOf(classificationRules);
    }
}

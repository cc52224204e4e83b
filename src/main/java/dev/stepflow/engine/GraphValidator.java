package dev.stepflow.engine;

import dev.stepflow.model.Connection;
import dev.stepflow.model.ConnectionType;
import dev.stepflow.model.DictionaryKind;
import dev.stepflow.model.RuleChain;
import dev.stepflow.model.Step;
import dev.stepflow.model.StepType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reports diagram problems that the compiler tolerates but a user probably
 * wants to fix. Validation never changes the generated table.
 */
public final class GraphValidator {

    private GraphValidator() {}

    /**
     * Inspect a diagram. Returns an empty list if nothing looks wrong,
     * otherwise one message per finding.
     */
    public static List<String> validate(StepGraph graph, Map<String, StepType> classifications, StepDictionary dictionary) {
        var warnings = new ArrayList<String>();
        var resolver = new RuleChainResolver(graph, classifications, dictionary);

        for (Connection connection : graph.connections()) {
            if (!graph.contains(connection.fromStepId()) || !graph.contains(connection.toStepId())) {
                warnings.add("Connection %s -> %s (%s) references an unknown step"
                    .formatted(connection.fromStepId(), connection.toStepId(), connection.type().label()));
            }
        }

        for (Step step : graph.steps()) {
            String name = graph.qualifiedName(step.id());

            if (step.hasParent() && !graph.contains(step.parentId())) {
                warnings.add("Step '%s' has unknown parent %s".formatted(name, step.parentId()));
            }

            String missing = missingOutgoing(graph.outgoing(step.id()));
            if (missing != null) {
                warnings.add("Step '%s' has no outgoing %s connection".formatted(name, missing));
            }

            StepType type = resolver.typeOf(step.id());
            int outDegree = graph.outgoing(step.id()).size();
            if (type != StepType.STATE && outDegree > 1) {
                warnings.add("%s step '%s' has %d outgoing connections; only the first is followed"
                    .formatted(capitalize(type.label()), name, outDegree));
            }

            if (type != StepType.STATE) {
                continue;
            }
            for (Connection connection : graph.outgoing(step.id())) {
                RuleChain chain = resolver.resolve(connection);
                String target = graph.qualifiedName(connection.toStepId());
                if (chain.end() == RuleChain.End.DANGLING) {
                    warnings.add("Transition '%s' -> '%s' never reaches a state".formatted(name, target));
                } else if (chain.end() == RuleChain.End.CYCLE) {
                    warnings.add("Transition '%s' -> '%s' loops through rule steps without reaching a state"
                        .formatted(name, target));
                }
            }
        }

        for (DictionaryKind kind : DictionaryKind.values()) {
            Set<String> live = new HashSet<>();
            for (Step step : graph.steps()) {
                if (resolver.typeOf(step.id()) == kind.stepType()) {
                    live.add(graph.qualifiedName(step.id()));
                }
            }
            for (String key : dictionary.entries(kind).keySet()) {
                if (!live.contains(key)) {
                    warnings.add("%s dictionary entry '%s' matches no %s step"
                        .formatted(capitalize(kind.stepType().label()), key, kind.stepType().label()));
                }
            }
        }

        return warnings;
    }

    /** Which of the success and failure branches a step lacks, or null if it has both. */
    private static String missingOutgoing(List<Connection> outgoing) {
        boolean success = false;
        boolean failure = false;
        for (Connection connection : outgoing) {
            success |= connection.type() == ConnectionType.SUCCESS;
            failure |= connection.type() == ConnectionType.FAILURE;
        }
        if (success && failure) {
            return null;
        }
        if (!success && !failure) {
            return "success or failure";
        }
        return success ? ConnectionType.FAILURE.label() : ConnectionType.SUCCESS.label();
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}

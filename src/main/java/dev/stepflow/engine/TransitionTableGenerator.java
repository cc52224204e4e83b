package dev.stepflow.engine;

import dev.stepflow.model.Connection;
import dev.stepflow.model.RuleChain;
import dev.stepflow.model.Step;
import dev.stepflow.model.StepType;
import dev.stepflow.model.TransitionRow;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Builds the transition table: one row per outgoing connection of every
 * state step, or a single row with no destination for a state without
 * connections. States come in step order and connections in connection
 * order, so equal inputs always give an equal table.
 */
public final class TransitionTableGenerator {

    private TransitionTableGenerator() {}

    public static List<TransitionRow> generateRows(
        Collection<Step> steps,
        Collection<Connection> connections,
        Map<String, StepType> classifications,
        Map<String, String> stateDictionary,
        Map<String, String> ruleDictionary
    ) {
        return generateRows(StepGraph.of(steps, connections), classifications,
            new StepDictionary(stateDictionary, ruleDictionary));
    }

    public static List<TransitionRow> generateRows(
        StepGraph graph,
        Map<String, StepType> classifications,
        StepDictionary dictionary
    ) {
        var resolver = new RuleChainResolver(graph, classifications, dictionary);
        var rows = new ArrayList<TransitionRow>();

        for (Step step : graph.steps()) {
            if (resolver.typeOf(step.id()) != StepType.STATE) {
                continue;
            }
            String source = resolver.stateLabel(step.id());
            List<Connection> outgoing = graph.outgoing(step.id());
            if (outgoing.isEmpty()) {
                rows.add(TransitionRow.terminal(source));
                continue;
            }
            for (Connection connection : outgoing) {
                RuleChain chain = resolver.resolve(connection);
                rows.add(TransitionRow.of(source, chain.destination(), chain.ruleList()));
            }
        }
        return Collections.unmodifiableList(rows);
    }
}

package dev.stepflow.engine;

import dev.stepflow.model.Connection;
import dev.stepflow.model.RuleChain;
import dev.stepflow.model.Step;
import dev.stepflow.model.StepType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Collapses the rule and behavior steps between two states into one
 * transition. Starting at the target of a state's outgoing connection, the
 * walk follows each step's first outgoing connection, collecting rule labels,
 * until it reaches a state, a step with no way out, or a step it has already
 * entered. Every step is entered at most once, so the walk always ends.
 */
public final class RuleChainResolver {

    private static final Logger log = LoggerFactory.getLogger(RuleChainResolver.class);

    private final StepGraph graph;
    private final Map<String, StepType> classifications;
    private final StepDictionary dictionary;

    public RuleChainResolver(StepGraph graph, Map<String, StepType> classifications, StepDictionary dictionary) {
        this.graph = graph;
        this.classifications = classifications;
        this.dictionary = dictionary;
    }

    /** Type of a step; steps without a classification count as states. */
    public StepType typeOf(String stepId) {
        return classifications.getOrDefault(stepId, StepType.STATE);
    }

    /**
     * Resolve one outgoing connection of a state step.
     */
    public RuleChain resolve(Connection connection) {
        Optional<Step> target = graph.step(connection.toStepId());
        if (target.isEmpty()) {
            log.debug("Connection {} points at an unknown step", connection);
            return new RuleChain(List.of(), "", RuleChain.End.DANGLING, 0);
        }
        if (typeOf(target.get().id()) == StepType.STATE) {
            return new RuleChain(List.of(), stateLabel(target.get().id()), RuleChain.End.DIRECT, 1);
        }

        var ruleNames = new ArrayList<String>();
        Set<String> visited = new HashSet<>();
        String current = target.get().id();

        while (true) {
            visited.add(current);
            if (typeOf(current) == StepType.RULE) {
                ruleNames.add(dictionary.lookupRuleName(graph.qualifiedName(current)));
            }

            List<Connection> next = graph.outgoing(current);
            if (next.isEmpty() || !graph.contains(next.get(0).toStepId())) {
                log.debug("Rule chain from {} ends at '{}' without reaching a state",
                    connection.fromStepId(), graph.qualifiedName(current));
                return new RuleChain(ruleNames, "", RuleChain.End.DANGLING, visited.size());
            }
            if (next.size() > 1) {
                log.debug("'{}' has {} outgoing connections, following the first",
                    graph.qualifiedName(current), next.size());
            }

            String nextId = next.get(0).toStepId();
            if (visited.contains(nextId)) {
                log.debug("Rule chain from {} loops back to '{}'",
                    connection.fromStepId(), graph.qualifiedName(nextId));
                return new RuleChain(ruleNames, "", RuleChain.End.CYCLE, visited.size());
            }
            if (typeOf(nextId) == StepType.STATE) {
                visited.add(nextId);
                return new RuleChain(ruleNames, stateLabel(nextId), RuleChain.End.STATE_REACHED, visited.size());
            }
            current = nextId;
        }
    }

    public String stateLabel(String stepId) {
        return dictionary.lookupStateName(graph.qualifiedName(stepId));
    }
}

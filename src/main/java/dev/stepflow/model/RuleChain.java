package dev.stepflow.model;

import java.util.List;

/**
 * Result of walking from a state step through rule and behavior steps.
 *
 * @param ruleNames   resolved rule labels in walk order
 * @param destination resolved label of the state reached, or "" when none was reached
 * @param end         why the walk stopped
 * @param visited     number of distinct non-source steps the walk entered
 */
public record RuleChain(
    List<String> ruleNames,
    String destination,
    End end,
    int visited
) {
    public static final String RULE_SEPARATOR = " + ";

    public enum End {
        /** The connection pointed straight at a state. */
        DIRECT,
        /** A state was reached after one or more rule/behavior steps. */
        STATE_REACHED,
        /** A rule/behavior step had no outgoing connection. */
        DANGLING,
        /** The walk came back to a step it had already entered. */
        CYCLE
    }

    public RuleChain {
        ruleNames = List.copyOf(ruleNames);
    }

    public String ruleList() {
        return String.join(RULE_SEPARATOR, ruleNames);
    }

    public boolean reachedState() {
        return end == End.DIRECT || end == End.STATE_REACHED;
    }
}

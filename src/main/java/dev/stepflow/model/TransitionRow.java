package dev.stepflow.model;

/**
 * One row of the exported state machine table.
 */
public record TransitionRow(
    String sourceNode,
    String destinationNode,
    String ruleList,
    int priority,
    String operation
) {
    public static final int DEFAULT_PRIORITY = 50;
    public static final String DEFAULT_OPERATION = "";

    public static TransitionRow of(String sourceNode, String destinationNode, String ruleList) {
        return new TransitionRow(sourceNode, destinationNode, ruleList, DEFAULT_PRIORITY, DEFAULT_OPERATION);
    }

    /** Row for a state with no outgoing connection. */
    public static TransitionRow terminal(String sourceNode) {
        return of(sourceNode, "", "");
    }

    public TransitionRow withPriority(int newPriority) {
        return new TransitionRow(sourceNode, destinationNode, ruleList, newPriority, operation);
    }

    public TransitionRow withOperation(String newOperation) {
        return new TransitionRow(sourceNode, destinationNode, ruleList, priority, newOperation == null ? "" : newOperation);
    }
}

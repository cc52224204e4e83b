package dev.stepflow.model;

/**
 * The two name dictionaries and the sentinel each one emits on a miss.
 */
public enum DictionaryKind {
    STATE("[UNKNOWN_STATE: %s]"),
    RULE("[UNKNOWN_RULE: %s]");

    private final String sentinelFormat;

    DictionaryKind(String sentinelFormat) {
        this.sentinelFormat = sentinelFormat;
    }

    public String sentinel(String qualifiedName) {
        return sentinelFormat.formatted(qualifiedName);
    }

    /** Step type whose steps this dictionary covers. */
    public StepType stepType() {
        return this == STATE ? StepType.STATE : StepType.RULE;
    }
}

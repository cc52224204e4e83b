package dev.stepflow.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Role of a step when the diagram is compiled into a transition table.
 */
public enum StepType {
    STATE("state"),
    RULE("rule"),
    BEHAVIOR("behavior");

    private final String label;

    StepType(String label) {
        this.label = label;
    }

    /** Lower-case name used in diagram files. */
    public String label() {
        return label;
    }

    /**
     * Parse a type label, ignoring case and surrounding whitespace.
     * Blank or unrecognised input yields empty.
     */
    public static Optional<StepType> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (StepType type : values()) {
            if (type.label.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}

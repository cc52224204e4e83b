package dev.stepflow.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of edge between two steps.
 */
public enum ConnectionType {
    SUCCESS("success"),
    FAILURE("failure");

    private final String label;

    ConnectionType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<ConnectionType> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ConnectionType type : values()) {
            if (type.label.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}

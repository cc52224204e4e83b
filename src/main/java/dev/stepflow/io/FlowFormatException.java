package dev.stepflow.io;

/**
 * Thrown when a diagram, dictionary or keyword file is well-formed JSON but
 * not in the expected shape.
 */
public class FlowFormatException extends IllegalArgumentException {

    public FlowFormatException(String message) {
        super(message);
    }
}

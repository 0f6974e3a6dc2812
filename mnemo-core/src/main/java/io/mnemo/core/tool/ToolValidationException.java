package io.mnemo.core.tool;

/**
 * Malformed invocation: missing parameter or wrong parameter type.
 */
public class ToolValidationException extends RuntimeException {

    public ToolValidationException(String message) {
        super(message);
    }
}

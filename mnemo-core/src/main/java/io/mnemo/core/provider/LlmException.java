package io.mnemo.core.provider;

import java.io.IOException;

/**
 * The inference call failed: transport error, non-success status or unusable body.
 */
public class LlmException extends IOException {
    private final int statusCode;

    public LlmException(String message) {
        this(message, -1, null);
    }

    public LlmException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public LlmException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status, or -1 when no response was received. */
    public int statusCode() {
        return statusCode;
    }
}

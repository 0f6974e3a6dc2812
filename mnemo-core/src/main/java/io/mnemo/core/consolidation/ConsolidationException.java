package io.mnemo.core.consolidation;

/**
 * A consolidation unit could not be completed and is left for the next run.
 */
public class ConsolidationException extends Exception {

    public ConsolidationException(String message) {
        super(message);
    }

    public ConsolidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

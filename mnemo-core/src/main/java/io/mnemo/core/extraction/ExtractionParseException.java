package io.mnemo.core.extraction;

/**
 * The classification output was not parseable or broke the expected schema.
 */
public class ExtractionParseException extends Exception {

    public ExtractionParseException(String message) {
        super(message);
    }

    public ExtractionParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

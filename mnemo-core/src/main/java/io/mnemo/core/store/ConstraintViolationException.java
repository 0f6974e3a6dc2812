package io.mnemo.core.store;

/**
 * Raised for schema, range or enum breaches before anything is written.
 */
public class ConstraintViolationException extends IllegalArgumentException {

    public ConstraintViolationException(String message) {
        super(message);
    }

    public static double requireImportance(double importance) {
        if (Double.isNaN(importance) || importance < 0.0 || importance > 1.0) {
            throw new ConstraintViolationException("importance must be within [0.0, 1.0] but was " + importance);
        }
        return importance;
    }

    public static int requireProgress(int progress) {
        if (progress < 0 || progress > 100) {
            throw new ConstraintViolationException("progress must be within [0, 100] but was " + progress);
        }
        return progress;
    }

    public static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ConstraintViolationException(field + " must not be blank");
        }
        return value.trim();
    }
}

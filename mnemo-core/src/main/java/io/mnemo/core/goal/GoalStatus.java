package io.mnemo.core.goal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.mnemo.core.store.ConstraintViolationException;
import java.util.Locale;

public enum GoalStatus {
    ACTIVE("active"),
    COMPLETED("completed"),
    ARCHIVED("archived");

    private final String value;

    GoalStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static GoalStatus fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConstraintViolationException("goal status must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (GoalStatus candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return candidate;
            }
        }
        throw new ConstraintViolationException("unknown goal status: " + raw);
    }
}

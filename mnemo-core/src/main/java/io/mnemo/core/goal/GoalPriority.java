package io.mnemo.core.goal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.mnemo.core.store.ConstraintViolationException;
import java.util.Locale;

public enum GoalPriority {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    GoalPriority(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static GoalPriority fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConstraintViolationException("goal priority must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (GoalPriority candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return candidate;
            }
        }
        throw new ConstraintViolationException("unknown goal priority: " + raw);
    }
}

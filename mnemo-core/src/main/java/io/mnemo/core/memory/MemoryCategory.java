package io.mnemo.core.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.mnemo.core.store.ConstraintViolationException;
import java.util.Locale;

public enum MemoryCategory {
    FACT("fact"),
    PREFERENCE("preference"),
    PERSONALITY("personality"),
    SKILL("skill"),
    GOAL_RELATED("goal_related");

    private final String value;

    MemoryCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Unknown values are rejected, never coerced to a default category.
     */
    @JsonCreator
    public static MemoryCategory fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConstraintViolationException("category must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (MemoryCategory category : values()) {
            if (category.value.equals(normalized)) {
                return category;
            }
        }
        throw new ConstraintViolationException("unknown memory category: " + raw);
    }
}

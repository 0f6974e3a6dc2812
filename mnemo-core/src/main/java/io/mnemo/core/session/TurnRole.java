package io.mnemo.core.session;

import com.fasterxml.jackson.annotation.JsonValue;
import io.mnemo.core.store.ConstraintViolationException;
import java.util.Locale;

public enum TurnRole {
    USER("user"),
    ASSISTANT("assistant");

    private final String value;

    TurnRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static TurnRole fromValue(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (TurnRole role : values()) {
            if (role.value.equals(normalized)) {
                return role;
            }
        }
        throw new ConstraintViolationException("unknown turn role: " + raw);
    }
}

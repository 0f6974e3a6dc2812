package io.mnemo.core.profile;

import io.mnemo.core.store.ConstraintViolationException;
import java.time.Instant;

public record ProfileAttribute(String key, String value, String category, Instant updatedAt) {
    public ProfileAttribute {
        key = ConstraintViolationException.requireText(key, "key");
        value = value == null ? "" : value.trim();
        category = category == null || category.isBlank() ? null : category.trim();
    }
}

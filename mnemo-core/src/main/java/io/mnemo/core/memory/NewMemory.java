package io.mnemo.core.memory;

import io.mnemo.core.store.ConstraintViolationException;

public record NewMemory(String content, MemoryCategory category, double importance) {
    public static final double DEFAULT_IMPORTANCE = 0.5;

    public NewMemory {
        content = ConstraintViolationException.requireText(content, "content");
        if (category == null) {
            throw new ConstraintViolationException("category must not be null");
        }
        ConstraintViolationException.requireImportance(importance);
    }
}

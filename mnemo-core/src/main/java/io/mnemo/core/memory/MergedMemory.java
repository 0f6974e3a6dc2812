package io.mnemo.core.memory;

import io.mnemo.core.store.ConstraintViolationException;
import java.time.Instant;

/**
 * Field values the surviving record takes after a merge.
 */
public record MergedMemory(
    String content,
    double importance,
    long accessCount,
    Instant updatedAt,
    Instant lastAccessedAt
) {
    public MergedMemory {
        content = ConstraintViolationException.requireText(content, "content");
        ConstraintViolationException.requireImportance(importance);
        if (accessCount < 0) {
            throw new ConstraintViolationException("accessCount must not be negative");
        }
    }
}

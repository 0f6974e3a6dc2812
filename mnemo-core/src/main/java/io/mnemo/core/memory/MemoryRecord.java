package io.mnemo.core.memory;

import io.mnemo.core.store.ConstraintViolationException;
import java.time.Instant;

public record MemoryRecord(
    long id,
    String content,
    MemoryCategory category,
    double importance,
    long accessCount,
    Instant lastAccessedAt,
    Instant createdAt,
    Instant updatedAt,
    Instant lastDecayedAt,
    Instant archivedAt
) {
    public MemoryRecord {
        if (category == null) {
            throw new ConstraintViolationException("category must not be null");
        }
        ConstraintViolationException.requireImportance(importance);
        if (accessCount < 0) {
            throw new ConstraintViolationException("accessCount must not be negative");
        }
        content = content == null ? "" : content;
    }

    public boolean archived() {
        return archivedAt != null;
    }

    /** Last access, or creation time for a record that was never retrieved. */
    public Instant lastTouchedAt() {
        return lastAccessedAt == null ? createdAt : lastAccessedAt;
    }
}

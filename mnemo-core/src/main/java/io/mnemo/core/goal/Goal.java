package io.mnemo.core.goal;

import io.mnemo.core.store.ConstraintViolationException;
import java.time.Instant;
import java.time.LocalDate;

public record Goal(
    long id,
    String title,
    String description,
    LocalDate deadline,
    GoalPriority priority,
    GoalStatus status,
    int progress,
    Instant createdAt,
    Instant updatedAt
) {
    public Goal {
        title = title == null ? "" : title;
        priority = priority == null ? GoalPriority.MEDIUM : priority;
        status = status == null ? GoalStatus.ACTIVE : status;
        ConstraintViolationException.requireProgress(progress);
    }
}

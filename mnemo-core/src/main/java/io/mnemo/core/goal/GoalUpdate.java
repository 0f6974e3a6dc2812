package io.mnemo.core.goal;

import io.mnemo.core.store.ConstraintViolationException;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Partial update; null fields keep their stored value.
 */
public record GoalUpdate(
    String title,
    String description,
    LocalDate deadline,
    GoalPriority priority,
    GoalStatus status,
    Integer progress
) {
    public GoalUpdate {
        if (title != null) {
            title = ConstraintViolationException.requireText(title, "title");
        }
        if (progress != null) {
            ConstraintViolationException.requireProgress(progress);
        }
    }

    public static GoalUpdate progress(int progress) {
        return new GoalUpdate(null, null, null, null, null, progress);
    }

    public static GoalUpdate status(GoalStatus status) {
        return new GoalUpdate(null, null, null, null, status, null);
    }

    public boolean isEmpty() {
        return title == null && description == null && deadline == null
            && priority == null && status == null && progress == null;
    }

    Goal applyTo(Goal goal, Instant updatedAt) {
        return new Goal(
            goal.id(),
            title == null ? goal.title() : title,
            description == null ? goal.description() : description,
            deadline == null ? goal.deadline() : deadline,
            priority == null ? goal.priority() : priority,
            status == null ? goal.status() : status,
            progress == null ? goal.progress() : progress,
            goal.createdAt(),
            updatedAt
        );
    }
}

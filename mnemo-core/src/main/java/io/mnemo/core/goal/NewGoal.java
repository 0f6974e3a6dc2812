package io.mnemo.core.goal;

import io.mnemo.core.store.ConstraintViolationException;
import java.time.LocalDate;

public record NewGoal(String title, String description, LocalDate deadline, GoalPriority priority) {
    public NewGoal {
        title = ConstraintViolationException.requireText(title, "title");
        description = description == null || description.isBlank() ? null : description.trim();
        priority = priority == null ? GoalPriority.MEDIUM : priority;
    }

    public static NewGoal titled(String title) {
        return new NewGoal(title, null, null, null);
    }
}

package io.mnemo.core.extraction;

import io.mnemo.core.goal.GoalPriority;
import io.mnemo.core.goal.NewGoal;
import java.time.LocalDate;

public record ExtractedGoal(String title, String description, LocalDate deadline, GoalPriority priority) {

    public NewGoal toNewGoal() {
        return new NewGoal(title, description, deadline, priority);
    }
}

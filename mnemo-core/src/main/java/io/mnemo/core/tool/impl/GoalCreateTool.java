package io.mnemo.core.tool.impl;

import io.mnemo.core.goal.Goal;
import io.mnemo.core.goal.GoalPriority;
import io.mnemo.core.goal.GoalStore;
import io.mnemo.core.goal.NewGoal;
import io.mnemo.core.tool.Tool;
import io.mnemo.core.tool.ToolArguments;
import io.mnemo.core.tool.ToolContext;
import io.mnemo.core.tool.ToolOperation;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Creates a goal unless an active goal with the same title already exists.
 */
public final class GoalCreateTool implements Tool {

    @Override
    public ToolOperation operation() {
        return ToolOperation.GOAL_CREATE;
    }

    @Override
    public String description() {
        return "Create a new goal for the user";
    }

    @Override
    public Map<String, Object> schema() {
        return Map.of(
            "type", "object",
            "properties", Map.of(
                "title", Map.of("type", "string"),
                "description", Map.of("type", "string"),
                "deadline", Map.of("type", "string", "format", "date"),
                "priority", Map.of("type", "string", "enum", Schemas.priorityValues())
            ),
            "required", List.of("title")
        );
    }

    @Override
    public Map<String, Object> execute(ToolArguments arguments, ToolContext context) throws IOException {
        GoalStore goals = context.requireService(ToolContext.GOAL_STORE, GoalStore.class);
        String title = arguments.requireString("title");
        String priority = arguments.optionalString("priority");
        NewGoal goal = new NewGoal(
            title,
            arguments.optionalString("description"),
            Schemas.date("deadline", arguments.optionalString("deadline")),
            priority == null || priority.isBlank() ? null : GoalPriority.fromValue(priority)
        );

        Optional<Goal> existing = goals.findActiveByTitle(goal.title());
        Goal stored = existing.isPresent() ? existing.get() : goals.create(goal);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", true);
        payload.put("goal_id", stored.id());
        payload.put("existing", existing.isPresent());
        return payload;
    }
}

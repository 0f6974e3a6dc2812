package io.mnemo.core.tool.impl;

import io.mnemo.core.goal.Goal;
import io.mnemo.core.goal.GoalPriority;
import io.mnemo.core.goal.GoalStatus;
import io.mnemo.core.goal.GoalStore;
import io.mnemo.core.goal.GoalUpdate;
import io.mnemo.core.tool.Tool;
import io.mnemo.core.tool.ToolArguments;
import io.mnemo.core.tool.ToolContext;
import io.mnemo.core.tool.ToolOperation;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class GoalUpdateTool implements Tool {

    @Override
    public ToolOperation operation() {
        return ToolOperation.GOAL_UPDATE;
    }

    @Override
    public String description() {
        return "Update a goal's progress (0-100), status, priority, title, description or deadline";
    }

    @Override
    public Map<String, Object> schema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("goal_id", Map.of("type", "integer"));
        properties.put("progress", Map.of("type", "integer", "minimum", 0, "maximum", 100));
        properties.put("status", Map.of("type", "string", "enum", Schemas.statusValues()));
        properties.put("priority", Map.of("type", "string", "enum", Schemas.priorityValues()));
        properties.put("title", Map.of("type", "string"));
        properties.put("description", Map.of("type", "string"));
        properties.put("deadline", Map.of("type", "string", "format", "date"));
        return Map.of("type", "object", "properties", properties, "required", List.of("goal_id"));
    }

    @Override
    public Map<String, Object> execute(ToolArguments arguments, ToolContext context) throws IOException {
        GoalStore goals = context.requireService(ToolContext.GOAL_STORE, GoalStore.class);
        long goalId = arguments.requireLong("goal_id");
        String status = arguments.optionalString("status");
        String priority = arguments.optionalString("priority");
        String title = arguments.optionalString("title");

        GoalUpdate update = new GoalUpdate(
            title == null || title.isBlank() ? null : title,
            arguments.optionalString("description"),
            Schemas.date("deadline", arguments.optionalString("deadline")),
            priority == null || priority.isBlank() ? null : GoalPriority.fromValue(priority),
            status == null || status.isBlank() ? null : GoalStatus.fromValue(status),
            arguments.optionalInt("progress")
        );
        Goal updated = goals.update(goalId, update);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", true);
        payload.put("goal", updated);
        return payload;
    }
}

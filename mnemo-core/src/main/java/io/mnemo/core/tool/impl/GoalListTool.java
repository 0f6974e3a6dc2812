package io.mnemo.core.tool.impl;

import io.mnemo.core.goal.Goal;
import io.mnemo.core.goal.GoalStatus;
import io.mnemo.core.goal.GoalStore;
import io.mnemo.core.tool.Tool;
import io.mnemo.core.tool.ToolArguments;
import io.mnemo.core.tool.ToolContext;
import io.mnemo.core.tool.ToolOperation;
import io.mnemo.core.tool.ToolValidationException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class GoalListTool implements Tool {
    private static final String ALL = "all";

    @Override
    public ToolOperation operation() {
        return ToolOperation.GOAL_LIST;
    }

    @Override
    public String description() {
        return "List the user's goals, active ones by default";
    }

    @Override
    public Map<String, Object> schema() {
        List<String> statuses = new ArrayList<>(Schemas.statusValues());
        statuses.add(ALL);
        return Map.of(
            "type", "object",
            "properties", Map.of(
                "status", Map.of("type", "string", "enum", statuses, "default", GoalStatus.ACTIVE.value())
            )
        );
    }

    @Override
    public Map<String, Object> execute(ToolArguments arguments, ToolContext context) throws IOException {
        GoalStore goals = context.requireService(ToolContext.GOAL_STORE, GoalStore.class);
        String raw = arguments.optionalString("status");
        GoalStatus status = GoalStatus.ACTIVE;
        if (raw != null && !raw.isBlank()) {
            String normalized = raw.trim().toLowerCase(Locale.ROOT);
            if (ALL.equals(normalized)) {
                status = null;
            } else {
                try {
                    status = GoalStatus.fromValue(normalized);
                } catch (IllegalArgumentException e) {
                    throw new ToolValidationException("'status' must be one of active, completed, archived, all");
                }
            }
        }

        List<Goal> found = goals.list(status);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", true);
        payload.put("goals", found);
        return payload;
    }
}

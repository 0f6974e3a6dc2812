package io.mnemo.core.tool.impl;

import io.mnemo.core.goal.GoalPriority;
import io.mnemo.core.goal.GoalStatus;
import io.mnemo.core.memory.MemoryCategory;
import io.mnemo.core.tool.ToolValidationException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;

final class Schemas {

    private Schemas() {
    }

    static List<String> categoryValues() {
        return Arrays.stream(MemoryCategory.values()).map(MemoryCategory::value).toList();
    }

    static List<String> priorityValues() {
        return Arrays.stream(GoalPriority.values()).map(GoalPriority::value).toList();
    }

    static List<String> statusValues() {
        return Arrays.stream(GoalStatus.values()).map(GoalStatus::value).toList();
    }

    static LocalDate date(String name, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new ToolValidationException("'" + name + "' must be an ISO date (yyyy-MM-dd)");
        }
    }
}

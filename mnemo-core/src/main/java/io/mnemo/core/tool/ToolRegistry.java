package io.mnemo.core.tool;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Dispatch table from operation to implementation.
 */
public final class ToolRegistry {
    private final Map<ToolOperation, Tool> tools = new EnumMap<>(ToolOperation.class);

    public synchronized void register(Tool tool) {
        if (tool == null || tool.operation() == null) {
            throw new IllegalArgumentException("tool and its operation must not be null");
        }
        tools.put(tool.operation(), tool);
    }

    public synchronized Optional<Tool> find(ToolOperation operation) {
        return Optional.ofNullable(tools.get(operation));
    }
}

package io.mnemo.core.tool.impl;

import io.mnemo.core.tool.ToolRegistry;

public final class MemoryTools {

    private MemoryTools() {
    }

    public static ToolRegistry registry() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new MemorySearchTool());
        registry.register(new MemoryStoreTool());
        registry.register(new GoalListTool());
        registry.register(new GoalUpdateTool());
        registry.register(new GoalCreateTool());
        registry.register(new ProfileGetTool());
        registry.register(new ProfileSetTool());
        return registry;
    }
}

package io.mnemo.core.tool.impl;

import io.mnemo.core.memory.CommitResult;
import io.mnemo.core.memory.MemoryCategory;
import io.mnemo.core.memory.MemoryCommitter;
import io.mnemo.core.memory.NewMemory;
import io.mnemo.core.tool.Tool;
import io.mnemo.core.tool.ToolArguments;
import io.mnemo.core.tool.ToolContext;
import io.mnemo.core.tool.ToolOperation;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class MemoryStoreTool implements Tool {

    @Override
    public ToolOperation operation() {
        return ToolOperation.MEMORY_STORE;
    }

    @Override
    public String description() {
        return "Remember a durable fact, preference, trait or skill of the user";
    }

    @Override
    public Map<String, Object> schema() {
        return Map.of(
            "type", "object",
            "properties", Map.of(
                "content", Map.of("type", "string"),
                "category", Map.of("type", "string", "enum", Schemas.categoryValues()),
                "importance", Map.of("type", "number", "minimum", 0.0, "maximum", 1.0,
                    "default", NewMemory.DEFAULT_IMPORTANCE)
            ),
            "required", List.of("content", "category")
        );
    }

    @Override
    public Map<String, Object> execute(ToolArguments arguments, ToolContext context) throws IOException {
        MemoryCommitter committer = context.requireService(ToolContext.MEMORY_COMMITTER, MemoryCommitter.class);
        String content = arguments.requireString("content");
        MemoryCategory category = MemoryCategory.fromValue(arguments.requireString("category"));
        Double importance = arguments.optionalDouble("importance");

        CommitResult result = committer.commit(new NewMemory(
            content,
            category,
            importance == null ? NewMemory.DEFAULT_IMPORTANCE : importance
        ));
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", true);
        payload.put("memory_id", result.record().id());
        payload.put("merged", result.merged());
        return payload;
    }
}

package io.mnemo.core.tool.impl;

import io.mnemo.core.profile.ProfileAttribute;
import io.mnemo.core.profile.ProfileStore;
import io.mnemo.core.tool.Tool;
import io.mnemo.core.tool.ToolArguments;
import io.mnemo.core.tool.ToolContext;
import io.mnemo.core.tool.ToolOperation;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ProfileSetTool implements Tool {

    @Override
    public ToolOperation operation() {
        return ToolOperation.PROFILE_SET;
    }

    @Override
    public String description() {
        return "Set a user profile attribute such as name, location or timezone";
    }

    @Override
    public Map<String, Object> schema() {
        return Map.of(
            "type", "object",
            "properties", Map.of(
                "key", Map.of("type", "string"),
                "value", Map.of("type", "string"),
                "category", Map.of("type", "string")
            ),
            "required", List.of("key", "value")
        );
    }

    @Override
    public Map<String, Object> execute(ToolArguments arguments, ToolContext context) throws IOException {
        ProfileStore store = context.requireService(ToolContext.PROFILE_STORE, ProfileStore.class);
        ProfileAttribute stored = store.upsert(
            arguments.requireString("key"),
            arguments.requireString("value"),
            arguments.optionalString("category")
        );
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", true);
        payload.put("key", stored.key());
        return payload;
    }
}

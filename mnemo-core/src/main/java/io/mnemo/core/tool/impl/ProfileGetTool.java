package io.mnemo.core.tool.impl;

import io.mnemo.core.profile.ProfileAttribute;
import io.mnemo.core.profile.ProfileStore;
import io.mnemo.core.tool.Tool;
import io.mnemo.core.tool.ToolArguments;
import io.mnemo.core.tool.ToolContext;
import io.mnemo.core.tool.ToolOperation;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

public final class ProfileGetTool implements Tool {

    @Override
    public ToolOperation operation() {
        return ToolOperation.PROFILE_GET;
    }

    @Override
    public String description() {
        return "Read user profile attributes; omit keys to read all of them";
    }

    @Override
    public Map<String, Object> schema() {
        return Map.of(
            "type", "object",
            "properties", Map.of(
                "keys", Map.of("type", "array", "items", Map.of("type", "string"))
            )
        );
    }

    @Override
    public Map<String, Object> execute(ToolArguments arguments, ToolContext context) throws IOException {
        ProfileStore store = context.requireService(ToolContext.PROFILE_STORE, ProfileStore.class);
        Map<String, Object> profile = new LinkedHashMap<>();
        for (ProfileAttribute attribute : store.get(arguments.optionalStringList("keys"))) {
            profile.put(attribute.key(), attribute.value());
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", true);
        payload.put("profile", profile);
        return payload;
    }
}

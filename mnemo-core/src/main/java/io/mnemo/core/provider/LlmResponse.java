package io.mnemo.core.provider;

import io.mnemo.core.model.ToolCall;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record LlmResponse(String content, List<ToolCall> toolCalls, Map<String, Object> usage) {
    public LlmResponse {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        usage = usage == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(usage));
    }

    public static LlmResponse text(String content) {
        return new LlmResponse(content, List.of(), Map.of());
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}

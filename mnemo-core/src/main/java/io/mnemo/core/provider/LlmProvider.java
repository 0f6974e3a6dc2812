package io.mnemo.core.provider;

import io.mnemo.core.model.ChatMessage;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Tool-augmented completion: messages and tool definitions in, text and/or tool calls out.
 */
public interface LlmProvider {
    String name();

    LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools) throws IOException;
}

package io.mnemo.core.provider;

import io.mnemo.core.model.ChatMessage;
import java.util.List;
import java.util.Map;

/**
 * Provider placeholder used when no API key is configured. Every call fails, so the turn
 * reports a generic failure and extraction is skipped.
 */
public final class DisabledProvider implements LlmProvider {
    private final String name;
    private final String reason;

    public DisabledProvider(String name, String reason) {
        this.name = name;
        this.reason = reason == null || reason.isBlank() ? "provider is disabled" : reason;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools)
        throws LlmException {
        throw new LlmException("provider " + name + " is not configured (" + reason + ")");
    }
}

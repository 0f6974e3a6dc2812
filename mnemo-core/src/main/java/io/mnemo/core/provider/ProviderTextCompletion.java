package io.mnemo.core.provider;

import io.mnemo.core.model.ChatMessage;
import java.io.IOException;
import java.util.List;

public final class ProviderTextCompletion implements TextCompletion {
    private final LlmProvider provider;
    private final String model;

    public ProviderTextCompletion(LlmProvider provider, String model) {
        if (provider == null) {
            throw new IllegalArgumentException("provider must not be null");
        }
        this.provider = provider;
        this.model = model;
    }

    @Override
    public String complete(String prompt) throws IOException {
        LlmResponse response = provider.chat(model, List.of(ChatMessage.user(prompt)), List.of());
        return response.content();
    }
}

package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderConfig(
    String name,
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"api_base"}) String apiBase,
    String model,
    @JsonAlias({"extra_headers"}) Map<String, String> extraHeaders,
    @JsonAlias({"max_attempts"}) int maxAttempts,
    @JsonAlias({"timeout_seconds"}) int timeoutSeconds
) {

    public static ProviderConfig defaults() {
        return new ProviderConfig("openai", "", "https://api.openai.com/v1", "gpt-4o-mini", Map.of(), 3, 90);
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }
}

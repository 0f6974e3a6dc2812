package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * @param model completion model used for extraction; blank falls back to the provider model
 * @param duplicateThreshold similarity at which a new memory reinforces an existing one instead
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractionConfig(
    boolean enabled,
    String model,
    @JsonAlias({"duplicate_threshold"}) double duplicateThreshold
) {

    public static ExtractionConfig defaults() {
        return new ExtractionConfig(true, "", 0.9);
    }
}

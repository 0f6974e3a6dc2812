package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.mnemo.core.segmentation.SegmentationPolicy;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SegmentationConfig(
    @JsonAlias({"reset_on_commit"}) boolean resetOnCommit,
    @JsonAlias({"max_turns"}) int maxTurns,
    @JsonAlias({"max_estimated_tokens"}) int maxEstimatedTokens,
    @JsonAlias({"explicit_patterns"}) List<String> explicitPatterns
) {

    public static SegmentationConfig defaults() {
        return new SegmentationConfig(true, 20, 3000, SegmentationPolicy.DEFAULT_EXPLICIT_PATTERNS);
    }

    public SegmentationPolicy toPolicy() {
        return new SegmentationPolicy(resetOnCommit, maxTurns, maxEstimatedTokens, explicitPatterns);
    }
}

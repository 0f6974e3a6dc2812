package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MnemoConfig(
    StorageConfig storage,
    ProviderConfig provider,
    RetrievalConfig retrieval,
    ExtractionConfig extraction,
    SegmentationConfig segmentation,
    ConsolidationConfig consolidation,
    AgentConfig agent
) {

    public static MnemoConfig defaults() {
        return new MnemoConfig(
            StorageConfig.defaults(),
            ProviderConfig.defaults(),
            RetrievalConfig.defaults(),
            ExtractionConfig.defaults(),
            SegmentationConfig.defaults(),
            ConsolidationConfig.defaults(),
            AgentConfig.defaults()
        );
    }
}

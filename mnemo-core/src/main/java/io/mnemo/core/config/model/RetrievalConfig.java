package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.mnemo.core.retrieval.QueryAnalyzer;
import io.mnemo.core.retrieval.RankingWeights;
import java.time.Duration;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RetrievalConfig(
    @JsonAlias({"text_weight"}) double textWeight,
    @JsonAlias({"importance_weight"}) double importanceWeight,
    @JsonAlias({"access_weight"}) double accessWeight,
    @JsonAlias({"recency_weight"}) double recencyWeight,
    @JsonAlias({"recency_half_life_days"}) double recencyHalfLifeDays,
    @JsonAlias({"recall_limit"}) int recallLimit,
    Map<String, List<String>> synonyms
) {

    public static RetrievalConfig defaults() {
        RankingWeights weights = RankingWeights.defaults();
        return new RetrievalConfig(
            weights.text(),
            weights.importance(),
            weights.access(),
            weights.recency(),
            14,
            5,
            QueryAnalyzer.defaultSynonyms()
        );
    }

    public RankingWeights toWeights() {
        long halfLifeMinutes = Math.round(recencyHalfLifeDays * 24 * 60);
        return new RankingWeights(textWeight, importanceWeight, accessWeight, recencyWeight,
            Duration.ofMinutes(halfLifeMinutes));
    }

    public QueryAnalyzer toAnalyzer() {
        return synonyms == null ? QueryAnalyzer.withDefaults() : new QueryAnalyzer(synonyms);
    }
}

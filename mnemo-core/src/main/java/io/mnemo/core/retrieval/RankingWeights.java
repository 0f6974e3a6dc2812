package io.mnemo.core.retrieval;

import java.time.Duration;

/**
 * Weights of the relevance score:
 * {@code text * match + importance * importance + access * log(1 + accessCount) + recency * 0.5^(elapsed / halfLife)}.
 * The default text weight keeps a full match ahead of a half match by more than importance and recency can add.
 */
public record RankingWeights(
    double text,
    double importance,
    double access,
    double recency,
    Duration recencyHalfLife
) {
    public RankingWeights {
        if (text < 0 || importance < 0 || access < 0 || recency < 0) {
            throw new IllegalArgumentException("ranking weights must not be negative");
        }
        if (recencyHalfLife == null || recencyHalfLife.isZero() || recencyHalfLife.isNegative()) {
            recencyHalfLife = Duration.ofDays(14);
        }
    }

    public static RankingWeights defaults() {
        return new RankingWeights(2.0, 0.5, 0.1, 0.2, Duration.ofDays(14));
    }
}

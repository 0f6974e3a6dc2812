package io.mnemo.core.consolidation;

import java.time.Duration;

/**
 * @param mergeThreshold similarity at or above which two live memories of one category are merged
 * @param decayWindow idle time after which a memory starts losing importance
 * @param decayPeriod length of one decay step
 * @param decayFactor multiplier applied per elapsed period
 * @param minImportance floor that decay never goes below
 * @param turnRetention age after which turns of a summarized session are archived
 * @param maxTranscriptChars upper bound of the transcript sent for summarization
 */
public record ConsolidationPolicy(
    double mergeThreshold,
    Duration decayWindow,
    Duration decayPeriod,
    double decayFactor,
    double minImportance,
    Duration turnRetention,
    int maxTranscriptChars
) {
    public ConsolidationPolicy {
        if (mergeThreshold <= 0.0 || mergeThreshold > 1.0) {
            throw new IllegalArgumentException("mergeThreshold must be within (0.0, 1.0]");
        }
        if (decayFactor <= 0.0 || decayFactor > 1.0) {
            throw new IllegalArgumentException("decayFactor must be within (0.0, 1.0]");
        }
        if (minImportance < 0.0 || minImportance > 1.0) {
            throw new IllegalArgumentException("minImportance must be within [0.0, 1.0]");
        }
        if (decayWindow == null || decayWindow.isNegative()) {
            throw new IllegalArgumentException("decayWindow must not be negative");
        }
        if (decayPeriod == null || decayPeriod.isZero() || decayPeriod.isNegative()) {
            throw new IllegalArgumentException("decayPeriod must be positive");
        }
        if (turnRetention == null || turnRetention.isNegative()) {
            throw new IllegalArgumentException("turnRetention must not be negative");
        }
        maxTranscriptChars = Math.max(500, maxTranscriptChars);
    }

    public static ConsolidationPolicy defaults() {
        return new ConsolidationPolicy(
            0.75,
            Duration.ofDays(30),
            Duration.ofDays(7),
            0.9,
            0.1,
            Duration.ofDays(7),
            12_000
        );
    }
}

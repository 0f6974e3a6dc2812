package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.mnemo.core.consolidation.ConsolidationPolicy;
import io.mnemo.core.consolidation.ConsolidationTrigger;
import io.mnemo.core.consolidation.ExplicitRequestTrigger;
import io.mnemo.core.consolidation.IntervalTrigger;
import io.mnemo.core.consolidation.TurnCountTrigger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Consolidation tuning. Day and minute fields are plain numbers so the file stays hand-editable;
 * a zero {@code intervalMinutes} or {@code turnThreshold} disables that trigger.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConsolidationConfig(
    @JsonAlias({"merge_threshold"}) double mergeThreshold,
    @JsonAlias({"decay_window_days"}) int decayWindowDays,
    @JsonAlias({"decay_period_days"}) int decayPeriodDays,
    @JsonAlias({"decay_factor"}) double decayFactor,
    @JsonAlias({"min_importance"}) double minImportance,
    @JsonAlias({"turn_retention_days"}) int turnRetentionDays,
    @JsonAlias({"max_transcript_chars"}) int maxTranscriptChars,
    @JsonAlias({"interval_minutes"}) int intervalMinutes,
    @JsonAlias({"turn_threshold"}) int turnThreshold,
    @JsonAlias({"poll_seconds"}) int pollSeconds
) {

    public static ConsolidationConfig defaults() {
        ConsolidationPolicy policy = ConsolidationPolicy.defaults();
        return new ConsolidationConfig(
            policy.mergeThreshold(),
            (int) policy.decayWindow().toDays(),
            (int) policy.decayPeriod().toDays(),
            policy.decayFactor(),
            policy.minImportance(),
            (int) policy.turnRetention().toDays(),
            policy.maxTranscriptChars(),
            360,
            50,
            60
        );
    }

    public ConsolidationPolicy toPolicy() {
        return new ConsolidationPolicy(
            mergeThreshold,
            Duration.ofDays(decayWindowDays),
            Duration.ofDays(decayPeriodDays),
            decayFactor,
            minImportance,
            Duration.ofDays(turnRetentionDays),
            maxTranscriptChars
        );
    }

    public List<ConsolidationTrigger> triggers() {
        List<ConsolidationTrigger> triggers = new ArrayList<>();
        triggers.add(new ExplicitRequestTrigger());
        if (intervalMinutes > 0) {
            triggers.add(new IntervalTrigger(Duration.ofMinutes(intervalMinutes)));
        }
        if (turnThreshold > 0) {
            triggers.add(new TurnCountTrigger(turnThreshold));
        }
        return triggers;
    }

    public Duration pollInterval() {
        return Duration.ofSeconds(Math.max(1, pollSeconds));
    }
}

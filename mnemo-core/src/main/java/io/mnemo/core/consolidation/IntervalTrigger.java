package io.mnemo.core.consolidation;

import java.time.Duration;
import java.time.Instant;

/**
 * Fires when at least {@code interval} has passed since the previous run, and before the first one.
 */
public final class IntervalTrigger implements ConsolidationTrigger {
    private final Duration interval;

    public IntervalTrigger(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.interval = interval;
    }

    @Override
    public boolean shouldRun(ConsolidationState state, Instant now) {
        return state.lastRunAt() == null || !now.isBefore(state.lastRunAt().plus(interval));
    }
}

package io.mnemo.core.consolidation;

import java.time.Instant;

/**
 * Scheduling metadata the triggers are evaluated against.
 *
 * @param lastRunAt null before the first run
 */
public record ConsolidationState(Instant lastRunAt, long turnsSinceLastRun, boolean explicitRequested) {
}

package io.mnemo.core.consolidation;

import java.time.Instant;

@FunctionalInterface
public interface ConsolidationTrigger {
    boolean shouldRun(ConsolidationState state, Instant now);
}

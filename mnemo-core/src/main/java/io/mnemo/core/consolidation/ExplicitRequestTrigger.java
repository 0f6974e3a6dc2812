package io.mnemo.core.consolidation;

import java.time.Instant;

/**
 * Fires once after {@link ConsolidationScheduler#requestRun()}, e.g. when a session closes.
 */
public final class ExplicitRequestTrigger implements ConsolidationTrigger {

    @Override
    public boolean shouldRun(ConsolidationState state, Instant now) {
        return state.explicitRequested();
    }
}

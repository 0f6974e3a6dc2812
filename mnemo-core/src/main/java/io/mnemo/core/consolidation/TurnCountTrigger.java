package io.mnemo.core.consolidation;

import java.time.Instant;

public final class TurnCountTrigger implements ConsolidationTrigger {
    private final long turns;

    public TurnCountTrigger(long turns) {
        if (turns <= 0) {
            throw new IllegalArgumentException("turns must be positive");
        }
        this.turns = turns;
    }

    @Override
    public boolean shouldRun(ConsolidationState state, Instant now) {
        return state.turnsSinceLastRun() >= turns;
    }
}

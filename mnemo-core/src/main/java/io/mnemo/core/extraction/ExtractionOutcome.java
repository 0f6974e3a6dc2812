package io.mnemo.core.extraction;

import java.util.List;

/**
 * Result of one extraction attempt with the states it passed through.
 *
 * @param failure short description of why the attempt was discarded or partially failed, null otherwise
 */
public record ExtractionOutcome(
    ExtractionState state,
    List<ExtractionState> trail,
    int memoriesCreated,
    int memoriesMerged,
    int goalsCreated,
    int profileFactsStored,
    String failure
) {
    public ExtractionOutcome {
        trail = trail == null ? List.of() : List.copyOf(trail);
    }

    public static ExtractionOutcome skipped(String reason) {
        return new ExtractionOutcome(
            ExtractionState.DISCARDED,
            List.of(ExtractionState.PENDING, ExtractionState.DISCARDED),
            0, 0, 0, 0,
            reason
        );
    }

    /** True when at least one memory or goal was written or reinforced. */
    public boolean committedAnything() {
        return state == ExtractionState.COMMITTED && (memoriesCreated + memoriesMerged + goalsCreated) > 0;
    }

    public int rowsWritten() {
        return memoriesCreated + memoriesMerged + goalsCreated + profileFactsStored;
    }
}

package io.mnemo.core.consolidation;

import java.time.Instant;

public record ConsolidationReport(
    Instant startedAt,
    Instant finishedAt,
    int sessionsSummarized,
    int summaryFailures,
    int memoriesMerged,
    int memoriesDecayed,
    int turnsArchived,
    int skippedBusy
) {
    public boolean changedAnything() {
        return sessionsSummarized + memoriesMerged + memoriesDecayed + turnsArchived > 0;
    }
}

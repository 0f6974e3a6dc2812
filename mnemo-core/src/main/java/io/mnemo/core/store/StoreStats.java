package io.mnemo.core.store;

public record StoreStats(
    long memories,
    long archivedMemories,
    long profileAttributes,
    long goals,
    long activeGoals,
    long sessions,
    long openSessions,
    long turns,
    long archivedTurns
) {
}

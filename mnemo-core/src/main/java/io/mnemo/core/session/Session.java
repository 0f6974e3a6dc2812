package io.mnemo.core.session;

import java.time.Instant;

/**
 * One bounded span of a conversation. {@code windowStart} is the sequence number of the first
 * turn in the active context window.
 */
public record Session(
    long id,
    String conversationId,
    Instant startedAt,
    Instant endedAt,
    String summary,
    int windowStart
) {
    public boolean isOpen() {
        return endedAt == null;
    }

    public boolean hasSummary() {
        return summary != null && !summary.isBlank();
    }
}

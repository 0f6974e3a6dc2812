package io.mnemo.core.session;

import java.time.Instant;

public record ConversationTurn(
    long id,
    long sessionId,
    int seq,
    TurnRole role,
    String content,
    Instant timestamp,
    boolean archived
) {
    public ConversationTurn {
        content = content == null ? "" : content;
    }
}

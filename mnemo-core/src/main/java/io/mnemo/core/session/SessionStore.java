package io.mnemo.core.session;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface SessionStore {
    /**
     * Starts a new session. Fails with a constraint violation if the conversation already has an open one.
     */
    Session open(String conversationId) throws IOException;

    Optional<Session> findOpen(String conversationId) throws IOException;

    Session get(long sessionId) throws IOException;

    Session close(long sessionId) throws IOException;

    /** Sets the summary of a closed session. */
    Session setSummary(long sessionId, String summary) throws IOException;

    /** Appends a turn at the next sequence number of an open session. */
    ConversationTurn appendTurn(long sessionId, TurnRole role, String content) throws IOException;

    List<ConversationTurn> listTurns(long sessionId) throws IOException;

    /** Turns from the window pointer onward that are not archived, in sequence order. */
    List<ConversationTurn> activeWindow(long sessionId) throws IOException;

    int lastSeq(long sessionId) throws IOException;

    /**
     * Moves the window pointer forward. A pointer at or beyond {@code windowStart} is left as is.
     *
     * @return true if the pointer moved
     */
    boolean advanceWindow(long sessionId, int windowStart) throws IOException;

    /**
     * Archives turns older than {@code cutoff} of a closed session. Only sessions that already carry a
     * summary are affected.
     *
     * @return the number of turns archived
     */
    int archiveTurnsBefore(long sessionId, Instant cutoff) throws IOException;

    /** Closed sessions, oldest first. */
    List<Session> listClosed(boolean unsummarizedOnly) throws IOException;
}

package io.mnemo.core.session;

/**
 * Identifies the conversation and its open session. Passed explicitly to every component that
 * reads or writes turns, so concurrent conversations never share state.
 */
public record ConversationContext(String conversationId, long sessionId) {
    public ConversationContext {
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("conversationId must not be blank");
        }
        if (sessionId <= 0) {
            throw new IllegalArgumentException("sessionId must be positive");
        }
    }

    public static ConversationContext of(Session session) {
        return new ConversationContext(session.conversationId(), session.id());
    }
}

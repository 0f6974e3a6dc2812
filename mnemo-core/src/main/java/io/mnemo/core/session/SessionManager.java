package io.mnemo.core.session;

import io.mnemo.core.store.ConstraintViolationException;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Session lifecycle per conversation: resumes the open session or starts one, and closes it on
 * request, notifying listeners afterwards.
 */
public final class SessionManager {
    private static final Logger LOG = LoggerFactory.getLogger(SessionManager.class);

    private final SessionStore store;
    private final List<SessionCloseListener> listeners = new CopyOnWriteArrayList<>();

    public SessionManager(SessionStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }
        this.store = store;
    }

    public void addCloseListener(SessionCloseListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public ConversationContext resolve(String conversationId) throws IOException {
        Optional<Session> open = store.findOpen(conversationId);
        if (open.isPresent()) {
            return ConversationContext.of(open.get());
        }
        try {
            Session session = store.open(conversationId);
            LOG.info("Opened session {} for conversation {}", session.id(), conversationId);
            return ConversationContext.of(session);
        } catch (ConstraintViolationException e) {
            // another writer opened one first
            return store.findOpen(conversationId)
                .map(ConversationContext::of)
                .orElseThrow(() -> e);
        }
    }

    public Session end(ConversationContext context) throws IOException {
        Session closed = store.close(context.sessionId());
        LOG.info("Closed session {} for conversation {}", closed.id(), closed.conversationId());
        for (SessionCloseListener listener : listeners) {
            try {
                listener.onSessionClosed(closed);
            } catch (RuntimeException e) {
                LOG.warn("Session close listener failed for session {}", closed.id(), e);
            }
        }
        return closed;
    }

    public SessionStore store() {
        return store;
    }
}

package io.mnemo.core.session;

@FunctionalInterface
public interface SessionCloseListener {
    void onSessionClosed(Session session);
}

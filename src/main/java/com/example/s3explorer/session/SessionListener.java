package com.example.s3explorer.session;

/**
 * Told when a session ends so the caller can send the user back to sign-in.
 */
@FunctionalInterface
public interface SessionListener {
    void sessionEnded(SessionEndReason reason);

    static SessionListener noop() {
        return reason -> {
        };
    }
}

package com.example.s3explorer.session;

import com.example.s3explorer.ExplorerException;

/**
 * The session could not be renewed and the stored credentials were cleared. The user has to sign
 * in again.
 */
public final class SessionExpiredException extends ExplorerException {

    private static final long serialVersionUID = 1L;

    private final SessionEndReason reason;

    public SessionExpiredException(SessionEndReason reason) {
        this(reason, null);
    }

    public SessionExpiredException(SessionEndReason reason, Throwable cause) {
        super("Session ended: " + reason.description(), cause);
        this.reason = reason;
    }

    public SessionEndReason getReason() {
        return reason;
    }
}

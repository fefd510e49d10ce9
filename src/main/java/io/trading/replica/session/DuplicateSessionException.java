package io.trading.replica.session;

/**
 * A session was started for an id that is already open.
 */
public class DuplicateSessionException extends IllegalStateException {

    private final SessionId sessionId;

    public DuplicateSessionException(SessionId sessionId) {
        super("Session " + sessionId + " already opened");
        this.sessionId = sessionId;
    }

    public SessionId getSessionId() {
        return sessionId;
    }
}

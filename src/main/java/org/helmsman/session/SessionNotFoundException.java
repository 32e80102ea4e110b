package org.helmsman.session;

/**
 * Thrown when a session id does not name an active session.
 */
public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("No active session '" + sessionId + "'");
    }
}

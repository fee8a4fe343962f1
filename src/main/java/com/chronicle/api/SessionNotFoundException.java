package com.chronicle.api;

/**
 * Thrown when a request names a chat session that does not exist.
 */
public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("session not found: " + sessionId);
    }
}

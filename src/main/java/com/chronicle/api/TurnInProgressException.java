package com.chronicle.api;

/**
 * Thrown when a turn is submitted while another turn of the same session is
 * still extracting.
 */
public class TurnInProgressException extends RuntimeException {

    public TurnInProgressException(String sessionId) {
        super("a turn is already running for session: " + sessionId);
    }
}

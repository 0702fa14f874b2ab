package com.openforge.storyagent.engine;

/**
 * Thrown when a turn is started on a session that is still running one.
 */
public class TurnInProgressException extends RuntimeException {

    public TurnInProgressException(String sessionId) {
        super("A turn is already in progress for session " + sessionId);
    }
}

package com.openforge.storyagent.engine;

/**
 * The language-model backend failed. Ends the current turn, never the session.
 */
public class FrameSourceException extends RuntimeException {

    public FrameSourceException(String message) {
        super(message);
    }

    public FrameSourceException(String message, Throwable cause) {
        super(message, cause);
    }

    public ErrorKind kind() {
        return ErrorKind.FRAME_SOURCE_FAILURE;
    }
}

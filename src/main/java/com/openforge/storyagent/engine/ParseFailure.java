package com.openforge.storyagent.engine;

/**
 * A complete delimited block whose payload could not be read as a tool call.
 */
public record ParseFailure(String sourceSpan, String reason) {

    public ErrorKind kind() {
        return ErrorKind.PARSE_FAILURE;
    }
}

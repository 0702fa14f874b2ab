package com.openforge.storyagent.engine;

/**
 * Every failure the engine can report. None of them escapes a turn as an
 * exception except {@link #FRAME_SOURCE_FAILURE}, and that one only ends
 * the current turn.
 */
public enum ErrorKind {

    /** Malformed tool-call payload. Dropped from the narrative, logged only. */
    PARSE_FAILURE,

    UNKNOWN_TOOL,

    MISSING_PARAMETER,

    BAD_PARAMETER_TYPE,

    /** The tool capability threw. */
    TOOL_EXECUTION_ERROR,

    /** Scene index outside the configured scene count; the update is skipped. */
    SLOT_OUT_OF_RANGE,

    /** The language-model backend failed or stopped before a final frame. */
    FRAME_SOURCE_FAILURE
}

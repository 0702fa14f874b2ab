package com.openforge.storyagent.agent.event;

/**
 * Classifies every event a story session emits over WebSocket.
 *
 * Flow per turn: TURN_STARTED → SNAPSHOT (one per frame, plus the opening one) → TURN_COMPLETED.
 */
public enum EventType {

    /** A turn was accepted. content = the user message. */
    TURN_STARTED,

    /** Full render state after a frame. snapshot = RenderSnapshot. */
    SNAPSHOT,

    /** The turn finished; snapshot = the committed state. */
    TURN_COMPLETED,

    /** The session was cleared back to its greeting. */
    SESSION_RESET,

    /** Unrecoverable error in the turn driver. content = message. */
    ERROR
}

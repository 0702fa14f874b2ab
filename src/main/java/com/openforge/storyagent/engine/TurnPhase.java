package com.openforge.storyagent.engine;

/**
 * States of one turn inside {@link SessionLoop}.
 *
 * IDLE → AWAITING_FRAME → EXTRACTING_CALLS → DISPATCHING → MERGING → EMITTING
 *      → (AWAITING_FRAME | DONE)
 */
public enum TurnPhase {
    IDLE,
    AWAITING_FRAME,
    EXTRACTING_CALLS,
    DISPATCHING,
    MERGING,
    EMITTING,
    DONE
}

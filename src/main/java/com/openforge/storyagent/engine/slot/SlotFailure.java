package com.openforge.storyagent.engine.slot;

import com.openforge.storyagent.engine.ErrorKind;

/**
 * A slot update the router refused to apply.
 */
public record SlotFailure(SlotUpdate update, String reason) {

    public ErrorKind kind() {
        return ErrorKind.SLOT_OUT_OF_RANGE;
    }

    /** Text merged into the transcript so the user sees what was skipped. */
    public String describe() {
        return "slot %s was not updated: %s".formatted(update.slotId(), reason);
    }
}

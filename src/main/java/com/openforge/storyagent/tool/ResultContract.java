package com.openforge.storyagent.tool;

import com.openforge.storyagent.engine.slot.SlotUpdate;

import java.util.List;

/**
 * Declares which slots a tool's result lands in. Scene-indexed tools key the
 * slot on their {@code idx} argument.
 */
@FunctionalInterface
public interface ResultContract {

    List<SlotUpdate> toSlotUpdates(ToolArguments arguments, Object result);

    /** The result is dropped; only the side effect matters. */
    static ResultContract none() {
        return (arguments, result) -> List.of();
    }
}

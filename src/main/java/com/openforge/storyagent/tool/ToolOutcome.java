package com.openforge.storyagent.tool;

import com.openforge.storyagent.engine.ErrorKind;
import com.openforge.storyagent.engine.slot.SlotUpdate;

import java.util.List;

/**
 * Normalized result of one tool invocation.
 */
public sealed interface ToolOutcome permits ToolOutcome.Success, ToolOutcome.Failure {

    String toolName();

    static ToolOutcome success(String toolName, List<SlotUpdate> slotUpdates) {
        return new Success(toolName, slotUpdates);
    }

    static ToolOutcome failure(ErrorKind kind, String toolName, String reason) {
        return new Failure(kind, toolName, reason);
    }

    record Success(String toolName, List<SlotUpdate> slotUpdates) implements ToolOutcome {
        public Success {
            slotUpdates = List.copyOf(slotUpdates);
        }
    }

    record Failure(ErrorKind kind, String toolName, String reason) implements ToolOutcome {

        /** The line shown to the user in place of the tool's result. */
        public String describe() {
            return "tool %s failed: %s".formatted(toolName, reason);
        }
    }
}

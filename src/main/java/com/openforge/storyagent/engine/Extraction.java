package com.openforge.storyagent.engine;

import java.util.List;

/**
 * Result of scanning one frame.
 *
 * @param calls     complete calls in document order
 * @param residual  displayable narrative with every delimited span removed
 * @param failures  blocks that were dropped because their payload was invalid
 */
public record Extraction(List<ToolCall> calls, String residual, List<ParseFailure> failures) {

    public Extraction {
        calls    = List.copyOf(calls);
        failures = List.copyOf(failures);
    }

    public boolean hasCalls() {
        return !calls.isEmpty();
    }
}

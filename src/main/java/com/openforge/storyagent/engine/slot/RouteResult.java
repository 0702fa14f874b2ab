package com.openforge.storyagent.engine.slot;

import java.util.List;

/**
 * Outcome of {@link SlotResultRouter#apply}: the new state plus every update
 * that was skipped.
 */
public record RouteResult(RenderState state, List<SlotFailure> failures) {

    public RouteResult {
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}

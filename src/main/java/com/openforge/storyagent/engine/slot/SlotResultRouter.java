package com.openforge.storyagent.engine.slot;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges tool results into the render state.
 *
 * Updates are applied in list order. Image, caption and story slots are
 * overwritten (last write wins); transcript updates append to the current
 * turn's agent text. An update whose scene index falls outside the
 * configured scene count is reported and skipped while the rest of the
 * batch still applies.
 */
@Slf4j
@Component
public class SlotResultRouter {

    public RouteResult apply(RenderState state, List<SlotUpdate> updates) {
        RenderState current = state;
        List<SlotFailure> failures = new ArrayList<>();

        for (SlotUpdate update : updates) {
            SlotId slot = update.slotId();
            if (slot.kind().indexed() && (slot.index() < 0 || slot.index() >= current.maxScenes())) {
                String reason = "scene index %d is out of range (%d scenes)"
                        .formatted(slot.index(), current.maxScenes());
                log.warn("[Router] Skipping update for {}: {}", slot, reason);
                failures.add(new SlotFailure(update, reason));
                continue;
            }
            current = switch (slot.kind()) {
                case TRANSCRIPT -> current.withTranscriptFragment(update.value());
                case IMAGE      -> current.withImage(slot.index(), update.value());
                case CAPTION    -> current.withCaption(slot.index(), update.value());
                case STORY      -> current.withStory(update.value());
            };
            log.debug("[Router] Applied update to {}", slot);
        }
        return new RouteResult(current, failures);
    }
}

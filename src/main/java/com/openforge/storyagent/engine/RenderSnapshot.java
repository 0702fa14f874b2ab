package com.openforge.storyagent.engine;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.storyagent.engine.slot.RenderState;
import com.openforge.storyagent.engine.slot.TranscriptTurn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The full observable state handed to the driver after every frame.
 *
 * camelCase on the wire regardless of the global naming strategy, the
 * frontend reads these fields directly.
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record RenderSnapshot(
        String            sessionId,
        List<Entry>       transcript,
        List<String>      images,
        List<String>      captions,
        String            story,
        boolean           done
) {

    public static RenderSnapshot of(String sessionId, RenderState state, boolean done) {
        List<Entry> entries = state.transcript().stream()
                .map(Entry::from)
                .toList();
        return new RenderSnapshot(sessionId, entries,
                Collections.unmodifiableList(new ArrayList<>(state.images())),
                Collections.unmodifiableList(new ArrayList<>(state.captions())),
                state.story(), done);
    }

    @JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
    public record Entry(String user, String agent) {
        static Entry from(TranscriptTurn turn) {
            return new Entry(turn.userText(), turn.agentText());
        }
    }
}

package com.openforge.storyagent.agent.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.storyagent.engine.RenderSnapshot;

/**
 * The single event envelope broadcast over WebSocket.
 *
 * Fields:
 *   sessionId  — the story session this event belongs to
 *   type       — discriminator; tells the frontend how to render the event
 *   content    — free-form text (user message for TURN_STARTED, message for ERROR)
 *   snapshot   — full render state; null for TURN_STARTED and ERROR
 *   timestamp  — epoch millis
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StoryEvent(
        String         sessionId,
        EventType      type,
        String         content,
        RenderSnapshot snapshot,
        long           timestamp
) {

    // ── Static factory helpers ───────────────────────────────────────────────

    public static StoryEvent turnStarted(String sessionId, String message) {
        return new StoryEvent(sessionId, EventType.TURN_STARTED, message, null, now());
    }

    public static StoryEvent snapshot(RenderSnapshot snapshot) {
        return new StoryEvent(snapshot.sessionId(), EventType.SNAPSHOT, null, snapshot, now());
    }

    public static StoryEvent turnCompleted(RenderSnapshot snapshot) {
        return new StoryEvent(snapshot.sessionId(), EventType.TURN_COMPLETED, null, snapshot, now());
    }

    public static StoryEvent reset(RenderSnapshot snapshot) {
        return new StoryEvent(snapshot.sessionId(), EventType.SESSION_RESET, null, snapshot, now());
    }

    public static StoryEvent error(String sessionId, String message) {
        return new StoryEvent(sessionId, EventType.ERROR, message, null, now());
    }

    private static long now() {
        return System.currentTimeMillis();
    }
}

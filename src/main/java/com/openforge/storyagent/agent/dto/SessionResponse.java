package com.openforge.storyagent.agent.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.storyagent.engine.RenderSnapshot;
import com.openforge.storyagent.engine.StorySession;
import com.openforge.storyagent.websocket.StoryEventPublisher;

/**
 * Response body for session endpoints.
 *
 * camelCase on the wire (overriding the global SNAKE_CASE strategy) so the
 * frontend can read "sessionId" and "wsSubscribePath" directly.
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record SessionResponse(
        String         sessionId,
        boolean        turnInFlight,
        String         wsSubscribePath,   // e.g. /topic/story/{sessionId}
        RenderSnapshot snapshot
) {

    public static SessionResponse from(StorySession session) {
        return new SessionResponse(
                session.id(),
                session.isTurnInFlight(),
                StoryEventPublisher.topicFor(session.id()),
                session.snapshot());
    }
}

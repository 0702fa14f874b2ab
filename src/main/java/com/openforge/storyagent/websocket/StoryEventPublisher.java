package com.openforge.storyagent.websocket;

import com.openforge.storyagent.agent.event.StoryEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Routes StoryEvents to the STOMP topic of their session.
 *
 * Topic layout:
 *   /topic/story/{sessionId}  → all events for one session
 *
 * SimpMessagingTemplate is thread-safe; turn drivers publish concurrently.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StoryEventPublisher {

    public static final String TOPIC_PREFIX = "/topic/story/";

    private final SimpMessagingTemplate messagingTemplate;

    public static String topicFor(String sessionId) {
        return TOPIC_PREFIX + sessionId;
    }

    /**
     * Fire-and-forget. A delivery failure is logged and never reaches the turn.
     */
    public void publish(StoryEvent event) {
        String destination = topicFor(event.sessionId());
        try {
            messagingTemplate.convertAndSend(destination, event);
        } catch (Exception e) {
            log.warn("[Publisher] Failed to deliver {} event to {}: {}",
                    event.type(), destination, e.getMessage());
        }
    }
}

package com.openforge.storyagent.agent;

import com.openforge.storyagent.agent.event.StoryEvent;
import com.openforge.storyagent.config.StoryProperties;
import com.openforge.storyagent.engine.RenderSnapshot;
import com.openforge.storyagent.engine.SessionLoop;
import com.openforge.storyagent.engine.StorySession;
import com.openforge.storyagent.engine.TurnInProgressException;
import com.openforge.storyagent.llm.LlmRouter;
import com.openforge.storyagent.llm.model.ChatRequest;
import com.openforge.storyagent.llm.model.Message;
import com.openforge.storyagent.websocket.StoryEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs story turns in the background and streams their snapshots.
 *
 * A turn is claimed on the calling thread, so a second request for a busy
 * session fails fast with {@link TurnInProgressException}. The turn itself
 * is driven on the agent executor; every snapshot goes to the session's
 * WebSocket topic.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StoryAgentService {

    private final SessionLoop                sessionLoop;
    private final ConversationContextService contextService;
    private final LlmRouter                  llmRouter;
    private final StoryEventPublisher        publisher;
    private final StoryProperties            properties;
    private final ExecutorService            agentExecutor;

    /** Frame source of the turn currently running per session. */
    private final Map<String, LlmFrameSource> liveSources = new ConcurrentHashMap<>();

    // ── Turns ────────────────────────────────────────────────────────────────

    /**
     * Starts a turn and returns once it is running.
     *
     * @throws TurnInProgressException if the session is already running a turn
     */
    public void submitTurn(StorySession session, String message) {
        List<Message> messages = contextService.buildMessages(session.memory(), message);
        ChatRequest request = ChatRequest.story(messages, properties.stopMarker());

        LlmFrameSource frames = new LlmFrameSource(
                (onToken, onRestart) -> llmRouter.streamChat(request, onToken, onRestart).content(),
                agentExecutor,
                Duration.ofSeconds(properties.frameTimeoutSeconds()),
                session.id());

        SessionLoop.Turn turn = sessionLoop.startTurn(session, message, frames);
        liveSources.put(session.id(), frames);
        publisher.publish(StoryEvent.turnStarted(session.id(), message));
        try {
            agentExecutor.submit(() -> {
                try {
                    drive(session, turn);
                } finally {
                    liveSources.remove(session.id(), frames);
                }
            });
        } catch (RejectedExecutionException e) {
            liveSources.remove(session.id(), frames);
            turn.close();
            throw e;
        }
    }

    /**
     * Drops the last turn from transcript and memory and runs it again.
     *
     * @throws IllegalStateException when the session has no user turn yet
     * @throws TurnInProgressException if the session is already running a turn
     */
    public void regenerate(StorySession session) {
        String message = session.rollbackLastTurn()
                .orElseThrow(() -> new IllegalStateException("Nothing to regenerate in session " + session.id()));
        log.info("[Agent:{}] Regenerating last turn.", session.id());
        submitTurn(session, message);
    }

    /**
     * Clears the session. A turn still running is abandoned and its model
     * stream is stopped.
     */
    public RenderSnapshot reset(StorySession session) {
        session.reset();
        LlmFrameSource running = liveSources.remove(session.id());
        if (running != null) {
            log.info("[Agent:{}] Stopping the running turn.", session.id());
            running.close();
        }
        RenderSnapshot snapshot = session.snapshot();
        publisher.publish(StoryEvent.reset(snapshot));
        return snapshot;
    }

    // ── Driver (runs on the agent executor) ─────────────────────────────────

    void drive(StorySession session, SessionLoop.Turn turn) {
        try (turn) {
            int snapshots = 0;
            while (turn.hasNext()) {
                publisher.publish(StoryEvent.snapshot(turn.next()));
                snapshots++;
            }
            log.debug("[Agent:{}] Published {} snapshot(s).", session.id(), snapshots);
            publisher.publish(StoryEvent.turnCompleted(session.snapshot()));
        } catch (RuntimeException e) {
            log.error("[Agent:{}] Turn driver failed: {}", session.id(), e.getMessage(), e);
            publisher.publish(StoryEvent.error(session.id(), e.getMessage()));
        }
    }
}

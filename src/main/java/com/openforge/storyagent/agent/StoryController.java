package com.openforge.storyagent.agent;

import com.openforge.storyagent.agent.dto.CreateSessionRequest;
import com.openforge.storyagent.agent.dto.SessionResponse;
import com.openforge.storyagent.agent.dto.TurnRequest;
import com.openforge.storyagent.engine.StorySession;
import com.openforge.storyagent.engine.TurnInProgressException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

/**
 * REST API for story sessions.
 *
 * Endpoints:
 *   POST   /api/story/sessions                 — create a session (greeting only)
 *   GET    /api/story/sessions/{id}            — current render snapshot
 *   POST   /api/story/sessions/{id}/turns      — send a user message, starts a turn
 *   POST   /api/story/sessions/{id}/regenerate — rerun the last user message
 *   POST   /api/story/sessions/{id}/reset      — clear transcript, slots and memory
 *   DELETE /api/story/sessions/{id}            — destroy the session
 *
 * Turns run in the background; the frontend subscribes to
 * /topic/story/{sessionId} (returned in every response) for snapshots.
 */
@Slf4j
@RestController
@RequestMapping("/api/story/sessions")
@RequiredArgsConstructor
public class StoryController {

    private final StorySessionManager sessionManager;
    private final StoryAgentService   agentService;

    // ── Create ───────────────────────────────────────────────────────────────

    @PostMapping
    public ResponseEntity<SessionResponse> createSession(
            @Valid @RequestBody(required = false) CreateSessionRequest request) {

        String sessionId = request != null && request.sessionId() != null && !request.sessionId().isBlank()
                ? request.sessionId()
                : UUID.randomUUID().toString();

        StorySession session;
        try {
            session = sessionManager.create(sessionId);
        } catch (IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(SessionResponse.from(session));
    }

    // ── Query ────────────────────────────────────────────────────────────────

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionResponse> getSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(SessionResponse.from(findOrThrow(sessionId)));
    }

    // ── Turns ────────────────────────────────────────────────────────────────

    /**
     * Accepts the message and returns immediately with HTTP 202. A second
     * message while the previous turn is still running gets HTTP 409.
     */
    @PostMapping("/{sessionId}/turns")
    public ResponseEntity<SessionResponse> sendMessage(@PathVariable String sessionId,
                                                       @Valid @RequestBody TurnRequest request) {
        StorySession session = findOrThrow(sessionId);
        try {
            agentService.submitTurn(session, request.message());
        } catch (TurnInProgressException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
        log.info("[Controller] Turn submitted for session {} — message: {}", sessionId,
                request.message().substring(0, Math.min(80, request.message().length())));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(SessionResponse.from(session));
    }

    @PostMapping("/{sessionId}/regenerate")
    public ResponseEntity<SessionResponse> regenerate(@PathVariable String sessionId) {
        StorySession session = findOrThrow(sessionId);
        try {
            agentService.regenerate(session);
        } catch (TurnInProgressException | IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(SessionResponse.from(session));
    }

    // ── Lifecycle ────────────────────────────────────────────────────────────

    /**
     * Clears the session. A running turn is abandoned; nothing it produces
     * afterwards reaches the session.
     */
    @PostMapping("/{sessionId}/reset")
    public ResponseEntity<SessionResponse> reset(@PathVariable String sessionId) {
        StorySession session = findOrThrow(sessionId);
        agentService.reset(session);
        log.info("[Controller] Reset session {}", sessionId);
        return ResponseEntity.ok(SessionResponse.from(session));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> destroy(@PathVariable String sessionId) {
        if (!sessionManager.destroy(sessionId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found: " + sessionId);
        }
        log.info("[Controller] Destroyed session {}", sessionId);
        return ResponseEntity.noContent().build();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private StorySession findOrThrow(String sessionId) {
        return sessionManager.find(sessionId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Session not found: " + sessionId));
    }
}

package com.openforge.storyagent.agent;

import com.openforge.storyagent.config.StoryProperties;
import com.openforge.storyagent.engine.StorySession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of live story sessions. Sessions are not persisted;
 * a restart starts every user over.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StorySessionManager {

    private final StoryProperties properties;

    private final Map<String, StorySession> sessions = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException if the id is already taken
     */
    public StorySession create(String sessionId) {
        StorySession session = new StorySession(sessionId, properties.maxScenes(), properties.greeting());
        if (sessions.putIfAbsent(sessionId, session) != null) {
            throw new IllegalStateException("Session already exists: " + sessionId);
        }
        log.info("[Sessions] Created {} ({} live)", sessionId, sessions.size());
        return session;
    }

    public Optional<StorySession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /** @return false when no such session existed */
    public boolean destroy(String sessionId) {
        StorySession session = sessions.remove(sessionId);
        if (session == null) return false;
        session.destroy();
        return true;
    }

    public int size() {
        return sessions.size();
    }
}

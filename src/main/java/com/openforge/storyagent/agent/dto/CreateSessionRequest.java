package com.openforge.storyagent.agent.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Request body for POST /api/story/sessions.
 *
 * @param sessionId optional; if null the server generates a UUID
 */
public record CreateSessionRequest(

        @Size(max = 64, message = "sessionId must not exceed 64 characters")
        @Pattern(regexp = "[A-Za-z0-9_-]*", message = "sessionId may only contain letters, digits, '-' and '_'")
        String sessionId
) {}

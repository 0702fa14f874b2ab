package com.openforge.storyagent.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * The request body sent to an OpenAI-compatible /chat/completions endpoint.
 *
 * {@code stop} cuts generation when the model starts writing the next user
 * turn on its own.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<Message> messages,
        Double temperature,
        Integer maxTokens,
        List<String> stop
) {

    public static ChatRequest story(List<Message> messages, String stopSequence) {
        return ChatRequest.builder()
                .messages(messages)
                .temperature(0.7)
                .maxTokens(4096)
                .stop(stopSequence == null || stopSequence.isBlank() ? null : List.of(stopSequence))
                .build();
    }
}

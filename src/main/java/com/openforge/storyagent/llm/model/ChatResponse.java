package com.openforge.storyagent.llm.model;

import java.util.List;

/**
 * Top-level response from /chat/completions, also used for the response
 * assembled from a stream.
 */
public record ChatResponse(
        String id,
        String model,
        List<Choice> choices
) {

    /** Convenience: first choice message (always present for a completed response). */
    public Message firstMessage() {
        if (choices == null || choices.isEmpty()) {
            throw new IllegalStateException("LLM returned no choices in response: " + id);
        }
        return choices.get(0).message();
    }

    /** Text of the first choice, never null. */
    public String content() {
        Message message = firstMessage();
        return message == null || message.content() == null ? "" : message.content();
    }

    public record Choice(
            int index,
            Message message,
            String finishReason
    ) {}
}

package com.openforge.storyagent.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A single entry in the conversation sent to the model.
 *
 * role variants:
 *   "system"    — story-agent persona, tool list and worked example
 *   "user"      — human turn
 *   "assistant" — model reply, tool-call blocks included verbatim
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        String role,
        String content
) {

    public static Message system(String content) {
        return new Message("system", content);
    }

    public static Message user(String content) {
        return new Message("user", content);
    }

    public static Message assistant(String content) {
        return new Message("assistant", content);
    }
}

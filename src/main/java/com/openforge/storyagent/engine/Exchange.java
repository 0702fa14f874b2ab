package com.openforge.storyagent.engine;

/**
 * One completed turn as the language model saw it. {@code agentText} keeps
 * the raw frame text, delimiters included, so the model sees its own tool
 * calls on the next turn.
 */
public record Exchange(String userText, String agentText) {}

package com.openforge.storyagent.engine;

/**
 * One unit of generated text.
 *
 * {@code text} is cumulative: it holds everything the model produced so far
 * in this turn, delimiters included.
 */
public record Frame(String text, boolean isFinal) {

    public Frame {
        text = text == null ? "" : text;
    }

    public static Frame partial(String text) {
        return new Frame(text, false);
    }

    public static Frame last(String text) {
        return new Frame(text, true);
    }
}

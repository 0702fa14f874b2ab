package com.openforge.storyagent.engine.slot;

/**
 * The families of addressable output locations in a {@link RenderState}.
 */
public enum SlotKind {

    /** The current turn's agent text. Updates append instead of overwrite. */
    TRANSCRIPT(false),

    /** Per-scene image reference (URL or file path). */
    IMAGE(true),

    /** Per-scene caption text shown under the image. */
    CAPTION(true),

    /** The full printed story. */
    STORY(false);

    private final boolean indexed;

    SlotKind(boolean indexed) {
        this.indexed = indexed;
    }

    public boolean indexed() {
        return indexed;
    }
}

package com.openforge.storyagent.engine;

import java.util.Optional;

/**
 * The language-model backend seen as an ordered sequence of frames.
 *
 * {@link #nextFrame()} blocks until a frame is ready. An empty result means
 * the source is exhausted; a well-behaved source returns a frame with
 * {@code isFinal = true} before that. Upstream failures surface as
 * {@link FrameSourceException}.
 */
public interface FrameSource extends AutoCloseable {

    Optional<Frame> nextFrame();

    /** Releases whatever is still producing frames. Idempotent. */
    @Override
    default void close() {
    }
}

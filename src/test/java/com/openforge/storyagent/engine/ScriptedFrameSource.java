package com.openforge.storyagent.engine;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Frame source for tests: hands out prepared frames (or failures) in order.
 */
class ScriptedFrameSource implements FrameSource {

    private final Deque<Supplier<Frame>> script = new ArrayDeque<>();
    private int pulled;
    private boolean closed;

    ScriptedFrameSource partial(String text) {
        script.add(() -> Frame.partial(text));
        return this;
    }

    ScriptedFrameSource last(String text) {
        script.add(() -> Frame.last(text));
        return this;
    }

    /** Runs {@code action} while the frame is being pulled, then hands out a final frame. */
    ScriptedFrameSource lastAfter(Runnable action, String text) {
        script.add(() -> {
            action.run();
            return Frame.last(text);
        });
        return this;
    }

    ScriptedFrameSource fail(String message) {
        script.add(() -> {
            throw new FrameSourceException(message);
        });
        return this;
    }

    @Override
    public Optional<Frame> nextFrame() {
        pulled++;
        Supplier<Frame> next = script.poll();
        return next == null ? Optional.empty() : Optional.of(next.get());
    }

    @Override
    public void close() {
        closed = true;
    }

    int pulled() {
        return pulled;
    }

    boolean isClosed() {
        return closed;
    }
}

package com.openforge.storyagent.agent;

import com.openforge.storyagent.engine.Frame;
import com.openforge.storyagent.engine.FrameSource;
import com.openforge.storyagent.engine.FrameSourceException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Turns a token-streaming model call into cumulative frames.
 *
 * The call starts on the executor at the first {@link #nextFrame()}. Every
 * token produces a partial frame holding all text so far; when the call
 * returns, a final frame follows. Frames that pile up while the consumer is
 * busy dispatching tools are coalesced: the consumer always gets the newest
 * one, never a final frame out of order.
 *
 * If the provider switches to its fallback mid-stream, the text collected so
 * far is discarded and the cumulative text starts over.
 */
@Slf4j
public class LlmFrameSource implements FrameSource {

    /**
     * A blocking model call. Implementations push each token to
     * {@code onToken}, run {@code onRestart} before starting over with
     * another provider, and return the complete reply.
     */
    @FunctionalInterface
    public interface StreamingGeneration {
        String generate(Consumer<String> onToken, Runnable onRestart);
    }

    private record Signal(String text, boolean last, RuntimeException error) {
        static Signal partial(String text)         { return new Signal(text, false, null); }
        static Signal last(String text)            { return new Signal(text, true, null); }
        static Signal failed(RuntimeException e)   { return new Signal(null, true, e); }
        static Signal closed()                     { return new Signal(null, true, null); }
    }

    private final StreamingGeneration generation;
    private final ExecutorService     executor;
    private final Duration            frameTimeout;
    private final String              label;

    private final BlockingQueue<Signal> signals = new LinkedBlockingQueue<>();
    private final StringBuilder         text    = new StringBuilder();

    private volatile boolean   closed;
    private volatile Future<?> producer;
    private boolean            exhausted;

    public LlmFrameSource(StreamingGeneration generation,
                          ExecutorService executor,
                          Duration frameTimeout,
                          String label) {
        this.generation   = generation;
        this.executor     = executor;
        this.frameTimeout = frameTimeout;
        this.label        = label;
    }

    @Override
    public Optional<Frame> nextFrame() {
        if (exhausted || closed) return Optional.empty();
        if (producer == null) {
            producer = executor.submit(this::produce);
        }

        Signal signal;
        try {
            signal = signals.poll(frameTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw new FrameSourceException("interrupted while waiting for the model", e);
        }
        if (closed) return Optional.empty();
        if (signal == null) {
            close();
            throw new FrameSourceException("no output from the model for %d seconds"
                    .formatted(frameTimeout.toSeconds()));
        }

        // coalesce: skip partial frames that are already out of date
        while (!signal.last()) {
            Signal newer = signals.poll();
            if (newer == null) break;
            signal = newer;
        }

        if (signal.error() != null) {
            exhausted = true;
            throw new FrameSourceException(signal.error().getMessage(), signal.error());
        }
        if (signal.last()) {
            exhausted = true;
            return Optional.of(Frame.last(signal.text()));
        }
        return Optional.of(Frame.partial(signal.text()));
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        // wakes a consumer blocked in nextFrame() on another thread
        signals.offer(Signal.closed());
        Future<?> running = producer;
        if (running != null && !running.isDone()) {
            log.debug("[FrameSource:{}] Cancelling generation", label);
            running.cancel(true);
        }
    }

    // ── Producer side (runs on the executor) ────────────────────────────────

    private void produce() {
        try {
            String reply = generation.generate(this::onToken, this::onRestart);
            if (reply == null) {
                synchronized (text) {
                    reply = text.toString();
                }
            }
            signals.offer(Signal.last(reply));
        } catch (CancellationException e) {
            log.debug("[FrameSource:{}] Generation stopped: {}", label, e.getMessage());
        } catch (RuntimeException e) {
            if (closed) {
                log.debug("[FrameSource:{}] Generation ended after close: {}", label, e.getMessage());
            } else {
                log.warn("[FrameSource:{}] Generation failed: {}", label, e.getMessage());
                signals.offer(Signal.failed(e));
            }
        }
    }

    private void onToken(String token) {
        if (closed) {
            throw new CancellationException("frame source closed");
        }
        String snapshot;
        synchronized (text) {
            text.append(token);
            snapshot = text.toString();
        }
        signals.offer(Signal.partial(snapshot));
    }

    private void onRestart() {
        if (closed) {
            throw new CancellationException("frame source closed");
        }
        log.info("[FrameSource:{}] Provider switched, restarting text", label);
        synchronized (text) {
            text.setLength(0);
        }
    }
}

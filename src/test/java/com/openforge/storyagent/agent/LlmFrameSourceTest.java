package com.openforge.storyagent.agent;

import com.openforge.storyagent.engine.ErrorKind;
import com.openforge.storyagent.engine.Frame;
import com.openforge.storyagent.engine.FrameSourceException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LlmFrameSourceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private ExecutorService executor;
    private CountDownLatch release;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        release = new CountDownLatch(1);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdownNow();
    }

    private void awaitRelease() {
        await(release);
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("test never released the generation");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted", e);
        }
    }

    private static List<Frame> drain(LlmFrameSource source) {
        List<Frame> frames = new ArrayList<>();
        Optional<Frame> frame;
        while ((frame = source.nextFrame()).isPresent()) {
            frames.add(frame.get());
        }
        return frames;
    }

    // ===== Normal stream =====

    @Test
    void shouldEndWithFinalFrameHoldingWholeReply() {
        LlmFrameSource source = new LlmFrameSource((onToken, onRestart) -> {
            onToken.accept("Once");
            onToken.accept(" upon");
            onToken.accept(" a time.");
            return "Once upon a time.";
        }, executor, TIMEOUT, "t");

        List<Frame> frames = drain(source);

        Frame last = frames.get(frames.size() - 1);
        assertTrue(last.isFinal());
        assertEquals("Once upon a time.", last.text());
        for (Frame frame : frames.subList(0, frames.size() - 1)) {
            assertFalse(frame.isFinal());
            assertTrue("Once upon a time.".startsWith(frame.text()));
        }
    }

    @Test
    void shouldCoalesceFramesQueuedWhileConsumerWasBusy() throws InterruptedException {
        CountDownLatch step = new CountDownLatch(1);
        CountDownLatch produced = new CountDownLatch(1);
        LlmFrameSource source = new LlmFrameSource((onToken, onRestart) -> {
            onToken.accept("a");
            await(step);
            onToken.accept("b");
            onToken.accept("c");
            produced.countDown();
            awaitRelease();
            return "abc";
        }, executor, TIMEOUT, "t");

        Frame first = source.nextFrame().orElseThrow();
        step.countDown();
        assertTrue(produced.await(5, TimeUnit.SECONDS));
        Frame second = source.nextFrame().orElseThrow();
        release.countDown();
        Frame third = source.nextFrame().orElseThrow();

        assertEquals(Frame.partial("a"), first);
        assertEquals(Frame.partial("abc"), second);
        assertEquals(Frame.last("abc"), third);
        assertTrue(source.nextFrame().isEmpty());
    }

    @Test
    void shouldRestartTextWhenProviderSwitches() throws InterruptedException {
        CountDownLatch step = new CountDownLatch(1);
        CountDownLatch restarted = new CountDownLatch(1);
        LlmFrameSource source = new LlmFrameSource((onToken, onRestart) -> {
            onToken.accept("broken reply");
            await(step);
            onRestart.run();
            onToken.accept("Fresh");
            restarted.countDown();
            awaitRelease();
            onToken.accept(" start");
            return null;
        }, executor, TIMEOUT, "t");

        Frame beforeRestart = source.nextFrame().orElseThrow();
        step.countDown();
        assertTrue(restarted.await(5, TimeUnit.SECONDS));
        Frame afterRestart = source.nextFrame().orElseThrow();
        release.countDown();
        List<Frame> rest = drain(source);

        assertEquals("broken reply", beforeRestart.text());
        assertEquals("Fresh", afterRestart.text());
        assertEquals(Frame.last("Fresh start"), rest.get(rest.size() - 1));
    }

    // ===== Failures =====

    @Test
    void shouldSurfaceGenerationFailure() {
        LlmFrameSource source = new LlmFrameSource((onToken, onRestart) -> {
            throw new IllegalStateException("provider down");
        }, executor, TIMEOUT, "t");

        FrameSourceException error = assertThrows(FrameSourceException.class, source::nextFrame);

        assertEquals("provider down", error.getMessage());
        assertEquals(ErrorKind.FRAME_SOURCE_FAILURE, error.kind());
        assertTrue(source.nextFrame().isEmpty());
    }

    @Test
    void shouldTimeOutStalledStream() {
        LlmFrameSource source = new LlmFrameSource((onToken, onRestart) -> {
            awaitRelease();
            return "";
        }, executor, Duration.ofMillis(100), "t");

        FrameSourceException error = assertThrows(FrameSourceException.class, source::nextFrame);

        assertTrue(error.getMessage().startsWith("no output from the model"));
        assertTrue(source.nextFrame().isEmpty());
    }

    @Test
    void shouldInterruptGenerationOnClose() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        LlmFrameSource source = new LlmFrameSource((onToken, onRestart) -> {
            onToken.accept("Once");
            started.countDown();
            try {
                new CountDownLatch(1).await();
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
            return "Once";
        }, executor, TIMEOUT, "t");

        source.nextFrame();
        assertTrue(started.await(5, TimeUnit.SECONDS));
        source.close();

        assertTrue(interrupted.await(5, TimeUnit.SECONDS));
        assertTrue(source.nextFrame().isEmpty());
    }

    @Test
    void shouldWakeBlockedConsumerWhenClosedFromAnotherThread() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        LlmFrameSource source = new LlmFrameSource((onToken, onRestart) -> {
            started.countDown();
            awaitRelease();
            return "";
        }, executor, TIMEOUT, "t");

        Future<Optional<Frame>> waiting = executor.submit(source::nextFrame);
        assertTrue(started.await(5, TimeUnit.SECONDS));
        source.close();

        assertEquals(Optional.empty(), waiting.get(1, TimeUnit.SECONDS));
    }

    @Test
    void shouldNotStartGenerationUntilFirstFrameIsRequested() {
        List<String> calls = new ArrayList<>();
        LlmFrameSource source = new LlmFrameSource((onToken, onRestart) -> {
            calls.add("called");
            return "";
        }, executor, TIMEOUT, "t");

        source.close();

        assertTrue(calls.isEmpty());
        assertTrue(source.nextFrame().isEmpty());
    }
}

package com.openforge.storyagent.engine;

import com.openforge.storyagent.engine.slot.RenderState;
import com.openforge.storyagent.engine.slot.RouteResult;
import com.openforge.storyagent.engine.slot.SlotFailure;
import com.openforge.storyagent.engine.slot.SlotResultRouter;
import com.openforge.storyagent.tool.ToolInvoker;
import com.openforge.storyagent.tool.ToolOutcome;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Drives one user turn.
 *
 * Turn shape:
 *   IDLE            — append the user message, emit a snapshot right away
 *   AWAITING_FRAME  — pull the next frame (blocks)
 *   EXTRACTING_CALLS— scan the cumulative frame text
 *   DISPATCHING     — invoke new calls one by one, in document order
 *   MERGING         — replace the narrative, route slot updates, append diagnostics
 *   EMITTING        — hand one snapshot to the caller
 *   DONE            — after the final frame, or when the frame source fails
 *
 * The turn is a pull-based iterator: nothing happens until the caller asks
 * for the next snapshot, and exactly one snapshot is produced per frame
 * (plus the opening one). Tool and routing failures never stop the loop;
 * they are merged into the transcript as plain text.
 *
 * Because frames are cumulative, a call seen in frame N is seen again in
 * frame N+1. Calls are remembered by position and source span and are
 * dispatched only the first time they appear.
 */
@Slf4j
public class SessionLoop {

    private final ToolCallExtractor extractor;
    private final ToolInvoker       invoker;
    private final SlotResultRouter  router;

    public SessionLoop(ToolCallExtractor extractor, ToolInvoker invoker, SlotResultRouter router) {
        this.extractor = extractor;
        this.invoker   = invoker;
        this.router    = router;
    }

    /**
     * Claims the session and returns the turn, still in {@link TurnPhase#IDLE}.
     *
     * @throws TurnInProgressException if the session is already running a turn
     */
    public Turn startTurn(StorySession session, String userInput, FrameSource frames) {
        long epoch = session.beginTurn();
        log.info("[Loop:{}] Turn started.", session.id());
        return new Turn(session, epoch, userInput, frames);
    }

    /**
     * One turn as an iterator of render snapshots. Not thread-safe; meant to
     * be consumed by a single driver thread.
     */
    public final class Turn implements Iterator<RenderSnapshot>, AutoCloseable {

        private final StorySession session;
        private final long         epoch;
        private final String       userInput;
        private final FrameSource  frames;

        private final List<String> dispatchedSpans = new ArrayList<>();
        private TurnPhase   phase = TurnPhase.IDLE;
        private RenderState state;
        private int         frameCount;
        private boolean     closed;

        private Turn(StorySession session, long epoch, String userInput, FrameSource frames) {
            this.session   = session;
            this.epoch     = epoch;
            this.userInput = userInput;
            this.frames    = frames;
        }

        public TurnPhase phase() {
            return phase;
        }

        @Override
        public boolean hasNext() {
            if (phase == TurnPhase.DONE) return false;
            if (!session.isCurrent(epoch)) {
                log.info("[Loop:{}] Session was reset, abandoning turn.", session.id());
                finish();
                return false;
            }
            return true;
        }

        @Override
        public RenderSnapshot next() {
            if (!hasNext()) {
                throw new NoSuchElementException("Turn is done");
            }
            if (phase == TurnPhase.IDLE) {
                state = session.state().withUserTurn(userInput);
                phase = TurnPhase.AWAITING_FRAME;
                return emit(false);
            }

            Frame frame;
            try {
                frame = frames.nextFrame().orElse(null);
            } catch (RuntimeException e) {
                if (!session.isCurrent(epoch)) return abandon();
                log.warn("[Loop:{}] Frame source failed: {}", session.id(), e.getMessage());
                return failTurn("generation failed: " + describe(e));
            }
            // the session may have been reset while nextFrame() was blocked
            if (!session.isCurrent(epoch)) return abandon();
            if (frame == null) {
                log.warn("[Loop:{}] Frame source exhausted after {} frame(s) without a final frame.",
                        session.id(), frameCount);
                return failTurn("generation ended before the reply was complete");
            }
            frameCount++;
            return processFrame(frame);
        }

        /** Stops the turn early. Whatever was already emitted stays in the session. */
        @Override
        public void close() {
            phase = TurnPhase.DONE;
            finish();
        }

        // ── Frame processing ────────────────────────────────────────────────

        private RenderSnapshot processFrame(Frame frame) {
            phase = TurnPhase.EXTRACTING_CALLS;
            Extraction extraction = extractor.extract(frame.text());
            log.debug("[Loop:{}] Frame {} final={} calls={} dropped={}", session.id(), frameCount,
                    frame.isFinal(), extraction.calls().size(), extraction.failures().size());

            List<ToolOutcome> outcomes = new ArrayList<>();
            if (extraction.hasCalls()) {
                phase = TurnPhase.DISPATCHING;
                outcomes = dispatchNewCalls(extraction.calls());
            }

            phase = TurnPhase.MERGING;
            state = state.withNarrative(extraction.residual());
            for (ToolOutcome outcome : outcomes) {
                merge(outcome);
            }

            if (frame.isFinal()) {
                session.recordExchange(epoch, new Exchange(userInput, frame.text()));
            }
            return emit(frame.isFinal());
        }

        private List<ToolOutcome> dispatchNewCalls(List<ToolCall> calls) {
            List<ToolOutcome> outcomes = new ArrayList<>();
            for (int i = 0; i < calls.size(); i++) {
                ToolCall call = calls.get(i);
                boolean seen = i < dispatchedSpans.size() && dispatchedSpans.get(i).equals(call.sourceSpan());
                if (seen) continue;
                if (!session.isCurrent(epoch)) {
                    log.info("[Loop:{}] Session was reset, skipping remaining tool calls.", session.id());
                    break;
                }

                log.info("[Loop:{}] Dispatching {} {}", session.id(), call.apiName(), call.parameters());
                outcomes.add(invoker.invoke(call));
                if (i < dispatchedSpans.size()) {
                    dispatchedSpans.set(i, call.sourceSpan());
                } else {
                    dispatchedSpans.add(call.sourceSpan());
                }
            }
            // a rewritten frame may hold fewer calls than an earlier one
            while (dispatchedSpans.size() > calls.size()) {
                dispatchedSpans.remove(dispatchedSpans.size() - 1);
            }
            return outcomes;
        }

        private void merge(ToolOutcome outcome) {
            if (outcome instanceof ToolOutcome.Success success) {
                RouteResult routed = router.apply(state, success.slotUpdates());
                state = routed.state();
                for (SlotFailure failure : routed.failures()) {
                    state = state.withTranscriptFragment(failure.describe());
                }
            } else if (outcome instanceof ToolOutcome.Failure failure) {
                state = state.withTranscriptFragment(failure.describe());
            }
        }

        private RenderSnapshot failTurn(String diagnostic) {
            state = state.withTranscriptFragment(diagnostic);
            return emit(true);
        }

        private RenderSnapshot emit(boolean last) {
            phase = TurnPhase.EMITTING;
            if (!session.commit(epoch, state)) {
                // reset while this frame was in flight: show the fresh session instead
                return abandon();
            }
            RenderSnapshot snapshot = RenderSnapshot.of(session.id(), state, last);
            if (last) {
                phase = TurnPhase.DONE;
                log.info("[Loop:{}] Turn done after {} frame(s).", session.id(), frameCount);
                finish();
            } else {
                phase = TurnPhase.AWAITING_FRAME;
            }
            return snapshot;
        }

        private RenderSnapshot abandon() {
            log.info("[Loop:{}] Session was reset, abandoning turn.", session.id());
            phase = TurnPhase.DONE;
            finish();
            return session.snapshot();
        }

        private void finish() {
            if (closed) return;
            closed = true;
            try {
                frames.close();
            } catch (RuntimeException e) {
                log.warn("[Loop:{}] Failed to close frame source: {}", session.id(), e.getMessage());
            }
            session.endTurn(epoch);
        }
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}

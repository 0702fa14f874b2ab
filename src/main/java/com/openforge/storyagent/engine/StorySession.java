package com.openforge.storyagent.engine;

import com.openforge.storyagent.engine.slot.RenderState;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One story-building session: the render state shown to the user and the
 * conversational memory sent back to the model.
 *
 * Lifecycle: create → runTurn* → reset → … → destroy.
 *
 * Turns are serialized. {@link #beginTurn()} rejects a second turn while one
 * is in flight, and every turn is bound to the epoch it started in. A reset
 * or destroy bumps the epoch, so a turn that is still running afterwards
 * can neither commit state nor record memory.
 */
@Slf4j
public class StorySession {

    private final String id;
    private final int    maxScenes;
    private final String greeting;

    private final AtomicBoolean  turnInFlight = new AtomicBoolean(false);
    private final List<Exchange> memory       = new ArrayList<>();

    private long        epoch;
    private boolean     destroyed;
    private RenderState state;

    public StorySession(String id, int maxScenes, String greeting) {
        this.id        = id;
        this.maxScenes = maxScenes;
        this.greeting  = greeting;
        this.state     = RenderState.initial(maxScenes, greeting);
    }

    public String id() {
        return id;
    }

    public synchronized RenderState state() {
        return state;
    }

    public synchronized RenderSnapshot snapshot() {
        return RenderSnapshot.of(id, state, !turnInFlight.get());
    }

    public synchronized List<Exchange> memory() {
        return List.copyOf(memory);
    }

    public boolean isTurnInFlight() {
        return turnInFlight.get();
    }

    public synchronized boolean isDestroyed() {
        return destroyed;
    }

    // ── Turn bookkeeping (used by SessionLoop) ──────────────────────────────

    /**
     * Claims the session for one turn.
     *
     * @return the epoch the turn belongs to
     * @throws TurnInProgressException if another turn holds the session
     */
    synchronized long beginTurn() {
        if (destroyed) {
            throw new IllegalStateException("Session destroyed: " + id);
        }
        if (!turnInFlight.compareAndSet(false, true)) {
            throw new TurnInProgressException(id);
        }
        return epoch;
    }

    synchronized boolean isCurrent(long turnEpoch) {
        return !destroyed && epoch == turnEpoch;
    }

    /** Publishes a turn's state. Returns false when the turn was reset away. */
    synchronized boolean commit(long turnEpoch, RenderState next) {
        if (!isCurrent(turnEpoch)) return false;
        state = next;
        return true;
    }

    synchronized void recordExchange(long turnEpoch, Exchange exchange) {
        if (isCurrent(turnEpoch)) {
            memory.add(exchange);
        }
    }

    synchronized void endTurn(long turnEpoch) {
        if (epoch == turnEpoch) {
            turnInFlight.set(false);
        }
    }

    // ── Lifecycle ────────────────────────────────────────────────────────────

    /**
     * Clears transcript, slots and memory back to what a new session has.
     * An in-flight turn is abandoned: nothing it produces afterwards is kept.
     */
    public synchronized void reset() {
        epoch++;
        state = RenderState.initial(maxScenes, greeting);
        memory.clear();
        turnInFlight.set(false);
        log.info("[Session:{}] Reset.", id);
    }

    /**
     * Removes the last user turn from the transcript and from memory so it
     * can be generated again. Image, caption and story slots are emptied,
     * the regenerated turn fills them from scratch.
     *
     * @return the user text of the removed turn, empty when there is none
     * @throws TurnInProgressException while a turn is running
     */
    public synchronized Optional<String> rollbackLastTurn() {
        if (turnInFlight.get()) {
            throw new TurnInProgressException(id);
        }
        if (state.transcript().isEmpty() || state.currentTurn().userText() == null) {
            return Optional.empty();
        }
        String userText = state.currentTurn().userText();
        state = state.withoutLastTurn().withoutSlots();
        if (!memory.isEmpty() && userText.equals(memory.get(memory.size() - 1).userText())) {
            memory.remove(memory.size() - 1);
        }
        return Optional.of(userText);
    }

    public synchronized void destroy() {
        destroyed = true;
        epoch++;
        memory.clear();
        turnInFlight.set(false);
        log.info("[Session:{}] Destroyed.", id);
    }
}

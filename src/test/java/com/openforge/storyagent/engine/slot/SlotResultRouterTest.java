package com.openforge.storyagent.engine.slot;

import com.openforge.storyagent.engine.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SlotResultRouterTest {

    private SlotResultRouter router;
    private RenderState state;

    @BeforeEach
    void setUp() {
        router = new SlotResultRouter();
        state = RenderState.initial(4, null).withUserTurn("draw it");
    }

    // ===== Overwrite slots =====

    @Test
    void shouldWriteImageAndCaptionAtIndex() {
        RouteResult result = router.apply(state, List.of(
                SlotUpdate.image(2, "http://img/2.png"),
                SlotUpdate.caption(2, "the bear")));

        assertFalse(result.hasFailures());
        assertEquals("http://img/2.png", result.state().images().get(2));
        assertEquals("the bear", result.state().captions().get(2));
        assertNull(result.state().images().get(0));
    }

    @Test
    void shouldLetLastWriteWinWithinBatch() {
        RouteResult result = router.apply(state, List.of(
                SlotUpdate.story("draft"),
                SlotUpdate.story("final")));

        assertEquals("final", result.state().story());
    }

    @Test
    void shouldBeIdempotentForOverwriteSlots() {
        List<SlotUpdate> updates = List.of(SlotUpdate.image(0, "a.png"), SlotUpdate.story("s"));

        RenderState once = router.apply(state, updates).state();
        RenderState twice = router.apply(once, updates).state();

        assertEquals(once, twice);
    }

    @Test
    void shouldCommuteForDistinctSlots() {
        SlotUpdate image = SlotUpdate.image(1, "b.png");
        SlotUpdate caption = SlotUpdate.caption(3, "end");

        RenderState forward = router.apply(state, List.of(image, caption)).state();
        RenderState backward = router.apply(state, List.of(caption, image)).state();

        assertEquals(forward, backward);
    }

    @Test
    void shouldLeaveInputStateUntouched() {
        router.apply(state, List.of(SlotUpdate.image(0, "a.png")));

        assertNull(state.images().get(0));
    }

    // ===== Transcript =====

    @Test
    void shouldAppendTranscriptUpdatesInOrder() {
        RenderState withNarrative = state.withNarrative("Here you go.");

        RouteResult result = router.apply(withNarrative, List.of(
                SlotUpdate.transcript("first"),
                SlotUpdate.transcript("second")));

        assertEquals("Here you go.\nfirst\nsecond", result.state().currentTurn().agentText());
    }

    // ===== Out of range =====

    @Test
    void shouldSkipOutOfRangeIndexAndApplyTheRest() {
        RouteResult result = router.apply(state, List.of(
                SlotUpdate.image(7, "x.png"),
                SlotUpdate.image(-1, "y.png"),
                SlotUpdate.caption(0, "ok")));

        assertEquals(2, result.failures().size());
        assertEquals(ErrorKind.SLOT_OUT_OF_RANGE, result.failures().get(0).kind());
        assertEquals("ok", result.state().captions().get(0));
        assertEquals(4, result.state().images().size());
        assertTrue(result.state().images().stream().allMatch(image -> image == null));
        assertEquals("slot image[7] was not updated: scene index 7 is out of range (4 scenes)",
                result.failures().get(0).describe());
    }

    @Test
    void shouldAcceptLastValidIndex() {
        RouteResult result = router.apply(state, List.of(SlotUpdate.image(3, "last.png")));

        assertFalse(result.hasFailures());
        assertEquals("last.png", result.state().valueOf(SlotId.image(3)));
    }

    @Test
    void shouldReturnSameStateForEmptyBatch() {
        RouteResult result = router.apply(state, List.of());

        assertSame(state, result.state());
        assertFalse(result.hasFailures());
    }
}

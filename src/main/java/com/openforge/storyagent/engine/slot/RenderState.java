package com.openforge.storyagent.engine.slot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything the driver renders: the transcript plus the fixed-length image
 * and caption arrays and the story slot.
 *
 * Immutable. Every mutator returns a new instance, so a stage can be tested
 * by comparing the state it was given with the state it returned. Empty
 * image, caption and story slots hold {@code null}.
 */
public record RenderState(
        List<TranscriptTurn> transcript,
        List<String>         images,
        List<String>         captions,
        String               story
) {

    public RenderState {
        if (images.size() != captions.size()) {
            throw new IllegalArgumentException("image and caption slot counts differ: %d vs %d"
                    .formatted(images.size(), captions.size()));
        }
        transcript = List.copyOf(transcript);
        // nulls are legitimate placeholders, so List.copyOf is not an option here
        images     = Collections.unmodifiableList(new ArrayList<>(images));
        captions   = Collections.unmodifiableList(new ArrayList<>(captions));
    }

    /**
     * The state of a freshly created (or freshly reset) session.
     *
     * @param greeting opening agent line, or null/blank for an empty transcript
     */
    public static RenderState initial(int maxScenes, String greeting) {
        if (maxScenes < 1) {
            throw new IllegalArgumentException("maxScenes must be positive: " + maxScenes);
        }
        List<String> empty = Collections.nCopies(maxScenes, null);
        List<TranscriptTurn> transcript = greeting == null || greeting.isBlank()
                ? List.of()
                : List.of(TranscriptTurn.greeting(greeting));
        return new RenderState(transcript, empty, empty, null);
    }

    public int maxScenes() {
        return images.size();
    }

    public TranscriptTurn currentTurn() {
        if (transcript.isEmpty()) {
            throw new IllegalStateException("transcript has no turns yet");
        }
        return transcript.get(transcript.size() - 1);
    }

    // ── Transcript ───────────────────────────────────────────────────────────

    public RenderState withUserTurn(String userText) {
        List<TranscriptTurn> next = new ArrayList<>(transcript);
        next.add(TranscriptTurn.pending(userText));
        return new RenderState(next, images, captions, story);
    }

    public RenderState withNarrative(String narrative) {
        return replaceCurrentTurn(currentTurn().withNarrative(narrative));
    }

    /** Appends to the current turn; opens an agent-only turn if there is none. */
    public RenderState withTranscriptFragment(String fragment) {
        if (transcript.isEmpty()) {
            return new RenderState(
                    List.of(new TranscriptTurn(null, "", List.of(fragment))), images, captions, story);
        }
        return replaceCurrentTurn(currentTurn().withFragment(fragment));
    }

    public RenderState withoutLastTurn() {
        if (transcript.isEmpty()) return this;
        return new RenderState(transcript.subList(0, transcript.size() - 1), images, captions, story);
    }

    private RenderState replaceCurrentTurn(TranscriptTurn turn) {
        List<TranscriptTurn> next = new ArrayList<>(transcript);
        next.set(next.size() - 1, turn);
        return new RenderState(next, images, captions, story);
    }

    // ── Slots ────────────────────────────────────────────────────────────────

    public RenderState withImage(int index, String reference) {
        List<String> next = new ArrayList<>(images);
        next.set(index, reference);
        return new RenderState(transcript, next, captions, story);
    }

    public RenderState withCaption(int index, String text) {
        List<String> next = new ArrayList<>(captions);
        next.set(index, text);
        return new RenderState(transcript, images, next, story);
    }

    public RenderState withStory(String text) {
        return new RenderState(transcript, images, captions, text);
    }

    /** Empties every image, caption and story slot; the transcript is kept. */
    public RenderState withoutSlots() {
        List<String> empty = Collections.nCopies(maxScenes(), null);
        return new RenderState(transcript, empty, empty, null);
    }

    /** Last written value of a slot; the agent text for the transcript slot. */
    public String valueOf(SlotId slotId) {
        return switch (slotId.kind()) {
            case TRANSCRIPT -> transcript.isEmpty() ? "" : currentTurn().agentText();
            case IMAGE      -> images.get(slotId.index());
            case CAPTION    -> captions.get(slotId.index());
            case STORY      -> story;
        };
    }
}

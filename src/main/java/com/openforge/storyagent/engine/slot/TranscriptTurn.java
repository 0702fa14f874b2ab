package com.openforge.storyagent.engine.slot;

import java.util.ArrayList;
import java.util.List;

/**
 * One (user, agent) exchange as the user sees it.
 *
 * The agent side is split in two: {@code narrative} is the displayable text
 * of the latest frame and is replaced on every frame, while
 * {@code fragments} (tool diagnostics, transcript slot writes) only ever
 * grow during the turn.
 *
 * @param userText  null for the opening greeting turn
 */
public record TranscriptTurn(String userText, String narrative, List<String> fragments) {

    public TranscriptTurn {
        narrative = narrative == null ? "" : narrative;
        fragments = List.copyOf(fragments);
    }

    public static TranscriptTurn pending(String userText) {
        return new TranscriptTurn(userText, "", List.of());
    }

    public static TranscriptTurn greeting(String text) {
        return new TranscriptTurn(null, text, List.of());
    }

    public TranscriptTurn withNarrative(String text) {
        return new TranscriptTurn(userText, text, fragments);
    }

    public TranscriptTurn withFragment(String fragment) {
        List<String> next = new ArrayList<>(fragments);
        next.add(fragment);
        return new TranscriptTurn(userText, narrative, next);
    }

    /** Narrative followed by the fragments, one per line. */
    public String agentText() {
        StringBuilder sb = new StringBuilder(narrative);
        for (String fragment : fragments) {
            if (!sb.isEmpty()) sb.append('\n');
            sb.append(fragment);
        }
        return sb.toString();
    }
}

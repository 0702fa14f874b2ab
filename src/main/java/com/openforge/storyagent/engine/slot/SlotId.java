package com.openforge.storyagent.engine.slot;

/**
 * Address of one output slot.
 *
 * Indexed kinds (image, caption) carry a zero-based scene index; the
 * others always use index {@code -1}.
 */
public record SlotId(SlotKind kind, int index) {

    private static final SlotId TRANSCRIPT = new SlotId(SlotKind.TRANSCRIPT, -1);
    private static final SlotId STORY      = new SlotId(SlotKind.STORY, -1);

    public SlotId {
        if (kind == null) {
            throw new IllegalArgumentException("slot kind must not be null");
        }
        if (!kind.indexed()) {
            index = -1;
        }
    }

    public static SlotId transcript() {
        return TRANSCRIPT;
    }

    public static SlotId story() {
        return STORY;
    }

    public static SlotId image(int index) {
        return new SlotId(SlotKind.IMAGE, index);
    }

    public static SlotId caption(int index) {
        return new SlotId(SlotKind.CAPTION, index);
    }

    @Override
    public String toString() {
        String name = kind.name().toLowerCase();
        return kind.indexed() ? name + "[" + index + "]" : name;
    }
}

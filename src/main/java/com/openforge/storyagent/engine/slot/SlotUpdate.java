package com.openforge.storyagent.engine.slot;

/**
 * One value destined for one slot.
 */
public record SlotUpdate(SlotId slotId, String value) {

    public static SlotUpdate transcript(String text) {
        return new SlotUpdate(SlotId.transcript(), text);
    }

    public static SlotUpdate story(String text) {
        return new SlotUpdate(SlotId.story(), text);
    }

    public static SlotUpdate image(int index, String reference) {
        return new SlotUpdate(SlotId.image(index), reference);
    }

    public static SlotUpdate caption(int index, String text) {
        return new SlotUpdate(SlotId.caption(index), text);
    }
}

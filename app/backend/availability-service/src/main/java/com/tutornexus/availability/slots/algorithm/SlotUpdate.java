package com.tutornexus.availability.slots.algorithm;

import lombok.Value;

@Value
public class SlotUpdate {
    SlotSnapshot existing;
    SlotDraft draft;

    /**
     * True when the update moves the slot to a different time range
     */
    public boolean changesTime() {
        return !existing.getDate().equals(draft.getDate())
                || !existing.getStartTime().equals(draft.getStartTime())
                || !existing.getEndTime().equals(draft.getEndTime());
    }
}

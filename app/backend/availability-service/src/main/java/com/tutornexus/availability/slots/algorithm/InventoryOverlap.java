package com.tutornexus.availability.slots.algorithm;

import com.tutornexus.availability.common.util.ScheduleTimes;
import lombok.Value;

@Value
public class InventoryOverlap {
    SlotSnapshot first;
    SlotSnapshot second;

    public String describe() {
        return String.format("%s-%s overlaps %s-%s (%s vs %s)",
                ScheduleTimes.formatTime(first.getStartTime()), ScheduleTimes.formatTime(first.getEndTime()),
                ScheduleTimes.formatTime(second.getStartTime()), ScheduleTimes.formatTime(second.getEndTime()),
                first.getNaturalKey(), second.getNaturalKey());
    }
}

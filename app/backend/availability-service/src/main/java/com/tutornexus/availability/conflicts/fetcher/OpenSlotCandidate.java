package com.tutornexus.availability.conflicts.fetcher;

import com.tutornexus.availability.common.entity.SlotInventory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
@AllArgsConstructor
public class OpenSlotCandidate {
    String id;
    String teacherId;
    LocalDateTime start;
    LocalDateTime end;

    public static OpenSlotCandidate from(SlotInventory slot) {
        return OpenSlotCandidate.builder()
                .id(String.valueOf(slot.getSlotId()))
                .teacherId(slot.getTeacherId())
                .start(slot.getDate().atTime(slot.getStartTime()))
                .end(slot.getDate().atTime(slot.getEndTime()))
                .build();
    }
}

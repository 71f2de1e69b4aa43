package com.tutornexus.availability.slots.algorithm;

import com.tutornexus.availability.common.entity.SlotInventory;
import com.tutornexus.availability.common.entity.SlotStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Set;

/**
 * Immutable view of an existing slot, taken at the persistence boundary.
 * Diffing and overlap reporting only ever see this shape.
 */
@Value
@Builder(toBuilder = true)
@AllArgsConstructor
public class SlotSnapshot {
    Long id;
    String naturalKey;
    String teacherId;
    LocalDate date;
    LocalTime startTime;
    LocalTime endTime;
    SlotStatus status;
    Long createdFromTemplateId;
    boolean locked;
    @Singular
    Set<String> linkedLessonIds;

    public static SlotSnapshot from(SlotInventory slot) {
        return SlotSnapshot.builder()
                .id(slot.getSlotId())
                .naturalKey(slot.getNaturalKey())
                .teacherId(slot.getTeacherId())
                .date(slot.getDate())
                .startTime(slot.getStartTime())
                .endTime(slot.getEndTime())
                .status(slot.getStatus())
                .createdFromTemplateId(slot.getCreatedFromTemplateId())
                .locked(Boolean.TRUE.equals(slot.getIsLocked()))
                .linkedLessonIds(slot.getLinkedLessonIds() == null ? Set.of() : slot.getLinkedLessonIds())
                .build();
    }

    public boolean hasLinkedLessons() {
        return !linkedLessonIds.isEmpty();
    }

    public boolean isBlock() {
        return status == SlotStatus.BLOCKED;
    }

    /**
     * Locked, booked or blocked slots belong to people, not to the sync engine.
     */
    public boolean isProtected() {
        return locked || hasLinkedLessons() || isBlock();
    }

    public LocalDateTime getStart() {
        return date.atTime(startTime);
    }

    public LocalDateTime getEnd() {
        return date.atTime(endTime);
    }
}

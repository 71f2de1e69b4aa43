package com.tutornexus.availability.slots.algorithm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * A slot a template says should exist
 */
@Value
@Builder
@AllArgsConstructor
public class SlotDraft {
    String naturalKey;
    String teacherId;
    LocalDate date;
    LocalTime startTime;
    LocalTime endTime;
    String type;
    Integer durationMinutes;
    Long createdFromTemplateId;
    int dayOfWeek;
}

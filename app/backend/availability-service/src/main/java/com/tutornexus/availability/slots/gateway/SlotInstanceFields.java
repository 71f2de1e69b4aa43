package com.tutornexus.availability.slots.gateway;

import com.tutornexus.availability.common.entity.SlotStatus;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Set;

/**
 * Field values for a create or a partial update. On update, null means "leave as is".
 */
@Value
@Builder
public class SlotInstanceFields {
    String naturalKey;
    String teacherId;
    LocalDate date;
    LocalTime startTime;
    LocalTime endTime;
    SlotStatus status;
    Long createdFromTemplateId;
    String lessonType;
    Boolean locked;
    Set<String> linkedLessonIds;
}

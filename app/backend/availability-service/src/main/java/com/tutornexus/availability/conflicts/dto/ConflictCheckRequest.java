package com.tutornexus.availability.conflicts.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tutornexus.availability.common.util.ScheduleTimes;
import com.tutornexus.availability.conflicts.service.ConflictQuery;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "Overlap check for a proposed lesson or slot")
public class ConflictCheckRequest {

    @NotNull(message = "entity is required")
    @Schema(description = "Kind of record being saved", example = "lesson", allowableValues = {"lesson", "slot_inventory"})
    private Entity entity;

    @Schema(description = "Record being edited (excluded from its own check)", example = "rec123")
    private String recordId;

    @Schema(description = "Lessons already linked to the slot being edited")
    private List<String> linkedLessonIds;

    @NotBlank(message = "teacherId is required")
    @Schema(description = "Teacher ID", example = "T1")
    private String teacherId;

    @NotBlank(message = "date is required")
    @Pattern(regexp = "\\d{4}-\\d{2}-\\d{2}", message = "date must be YYYY-MM-DD")
    @Schema(description = "Day of the proposed range", example = "2025-01-27")
    private String date;

    @NotBlank(message = "start is required")
    @Schema(description = "HH:mm or ISO local date-time", example = "10:00")
    private String start;

    @NotBlank(message = "end is required")
    @Schema(description = "HH:mm or ISO local date-time", example = "11:00")
    private String end;

    public enum Entity {
        @JsonProperty("lesson")
        LESSON,
        @JsonProperty("slot_inventory")
        SLOT_INVENTORY
    }

    /**
     * Candidates are fetched for {@code date} only, so an ISO start must fall on that day and an ISO
     * end on that day or at the following midnight.
     *
     * @throws IllegalArgumentException if date or times cannot be parsed, fall outside {@code date},
     *                                  or end is not after start
     */
    public ConflictQuery toQuery() {
        LocalDate day = LocalDate.parse(date, ScheduleTimes.DATE_FORMATTER);
        LocalDateTime startAt = ScheduleTimes.resolveDateTime(day, start);
        LocalDateTime endAt = ScheduleTimes.resolveDateTime(day, end);
        if (!startAt.toLocalDate().equals(day)) {
            throw new IllegalArgumentException("start must fall on " + date);
        }
        if (!endAt.toLocalDate().equals(day) && !endAt.equals(day.plusDays(1).atStartOfDay())) {
            throw new IllegalArgumentException("end must fall on " + date);
        }
        if (!endAt.isAfter(startAt)) {
            throw new IllegalArgumentException("end must be after start");
        }
        return ConflictQuery.builder()
                .teacherId(teacherId)
                .date(day)
                .start(startAt)
                .end(endAt)
                .excludeRecordId(recordId)
                .excludeLinkedRecordIds(linkedLessonIds == null ? new HashSet<>() : new HashSet<>(linkedLessonIds))
                .build();
    }
}

package com.tutornexus.availability.conflicts.dto;

import com.tutornexus.availability.overlap.algorithm.Interval;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "One overlapping record")
public class ConflictItemResponse {

    @Schema(description = "Origin of the record", example = "lessons", allowableValues = {"lessons", "slot_inventory"})
    private String source;

    @Schema(description = "Record ID", example = "rec123")
    private String recordId;

    @Schema(description = "Start", example = "2025-01-27T10:00:00")
    private LocalDateTime start;

    @Schema(description = "End", example = "2025-01-27T11:00:00")
    private LocalDateTime end;

    @Schema(description = "Student name for lessons, fixed label for slots", example = "Dana")
    private String label;

    public static ConflictItemResponse from(Interval interval) {
        return ConflictItemResponse.builder()
                .source(interval.getSource().getWireName())
                .recordId(interval.getRecordId())
                .start(interval.getStart())
                .end(interval.getEnd())
                .label(interval.getLabel())
                .build();
    }
}

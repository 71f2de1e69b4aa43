package com.tutornexus.availability.slots.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "Slot sync run. Every field is optional.")
public class SlotSyncRequest {

    public static final int MAX_DAYS_AHEAD = 365;

    @Schema(description = "Any day of the first week to sync (defaults to today)", example = "2025-01-27")
    private LocalDate startDate;

    @Min(value = 0, message = "daysAhead must not be negative")
    @Max(value = MAX_DAYS_AHEAD, message = "daysAhead must be at most 365")
    @Schema(description = "Horizon in days from the week start, inclusive", example = "14")
    private Integer daysAhead;

    @Schema(description = "Limit the run to one teacher", example = "T1")
    private String teacherId;
}

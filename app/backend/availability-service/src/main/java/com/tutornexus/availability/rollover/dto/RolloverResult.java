package com.tutornexus.availability.rollover.dto;

import com.tutornexus.availability.slots.dto.SlotSyncResult;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of a weekly rollover")
public class RolloverResult {

    @Schema(description = "Week that left the booking window (Sunday)", example = "2025-01-26")
    private LocalDate closedWeek;

    @Schema(description = "Week that entered the booking window (Sunday)", example = "2025-02-09")
    private LocalDate openedWeek;

    @Schema(description = "True when nothing was written")
    private boolean dryRun;

    @Schema(description = "Slot sync of the opened week (null on a dry run)")
    private SlotSyncResult slotResult;

    private int fixedLessonsCreated;

    private int fixedLessonsSkipped;
}

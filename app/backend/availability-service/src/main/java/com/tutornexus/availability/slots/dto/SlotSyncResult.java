package com.tutornexus.availability.slots.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of a slot sync run")
public class SlotSyncResult {

    private LocalDate windowStart;

    private LocalDate windowEnd;

    private int created;

    private int updated;

    private int deactivated;

    @Schema(description = "Overlapping slot pairs found in the existing inventory (reported, not fixed)")
    private int overlapsDetected;

    @Builder.Default
    private List<SyncError> errors = new ArrayList<>();

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }
}

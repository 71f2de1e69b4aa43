package com.tutornexus.availability.conflicts.dto;

import com.tutornexus.availability.conflicts.service.ConflictCheckResult;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "Overlap check result")
public class ConflictCheckResponse {

    @Schema(description = "True when at least one record overlaps", example = "true")
    private boolean hasConflicts;

    @Schema(description = "Overlapping records, sorted by start ascending")
    private List<ConflictItemResponse> conflicts;

    public static ConflictCheckResponse from(ConflictCheckResult result) {
        return ConflictCheckResponse.builder()
                .hasConflicts(result.hasConflicts())
                .conflicts(result.getConflicts().stream()
                        .map(ConflictItemResponse::from)
                        .collect(Collectors.toList()))
                .build();
    }
}

package com.tutornexus.availability.slots.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Failure of a single sync item")
public class SyncError {

    @Schema(description = "Natural key of the affected slot", example = "T1|2025-01-27|10:00")
    private String naturalKey;

    private SyncErrorType type;

    private String message;

    @Schema(description = "Lesson ids the slot would have overlapped (CONFLICT only)")
    private List<String> conflictingRecordIds;

    public static SyncError applyFailed(String naturalKey, Throwable cause) {
        return SyncError.builder()
                .naturalKey(naturalKey)
                .type(SyncErrorType.APPLY_FAILED)
                .message(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName())
                .conflictingRecordIds(List.of())
                .build();
    }

    public static SyncError conflict(String naturalKey, List<String> lessonIds) {
        return SyncError.builder()
                .naturalKey(naturalKey)
                .type(SyncErrorType.CONFLICT)
                .message("Slot overlaps existing lessons: " + String.join(", ", lessonIds))
                .conflictingRecordIds(List.copyOf(lessonIds))
                .build();
    }
}

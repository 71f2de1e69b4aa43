package com.tutornexus.availability.conflicts.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Set;

/**
 * A proposed booking to check.
 * excludeRecordId is the record being edited; excludeLinkedRecordIds are lessons already
 * attached to the slot being edited.
 */
@Value
@Builder
@AllArgsConstructor
public class ConflictQuery {
    String teacherId;
    LocalDate date;
    LocalDateTime start;
    LocalDateTime end;
    String excludeRecordId;
    @Singular
    Set<String> excludeLinkedRecordIds;
}

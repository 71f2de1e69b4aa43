package com.tutornexus.availability.slots.service;

import com.tutornexus.availability.conflicts.exception.ConflictCheckFailedException;
import com.tutornexus.availability.conflicts.service.ConflictCheckResult;
import com.tutornexus.availability.conflicts.service.ConflictDetector;
import com.tutornexus.availability.conflicts.service.ConflictQuery;
import com.tutornexus.availability.overlap.algorithm.Interval;
import com.tutornexus.availability.overlap.algorithm.IntervalSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks that a slot about to be opened does not overlap a lesson of the same teacher.
 * Only lessons count here; other open slots are reported by the inventory overlap pass.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlotOpeningGuard {

    private final ConflictDetector conflictDetector;

    public SlotOpeningCheck check(String teacherId, LocalDate date, LocalTime startTime, LocalTime endTime,
                                  Set<String> linkedLessonIds) {
        ConflictQuery query = ConflictQuery.builder()
                .teacherId(teacherId)
                .date(date)
                .start(date.atTime(startTime))
                .end(date.atTime(endTime))
                .excludeLinkedRecordIds(linkedLessonIds == null ? Set.of() : linkedLessonIds)
                .build();

        ConflictCheckResult result;
        try {
            result = conflictDetector.check(query);
        } catch (ConflictCheckFailedException e) {
            log.warn("Opening check unavailable - teacherId={}, date={}, {}~{}: {}",
                    teacherId, date, startTime, endTime, e.getCause() != null ? e.getCause().toString() : e.getMessage());
            return SlotOpeningCheck.checkUnavailable(e.getMessage());
        }

        List<String> lessonIds = result.conflictsFrom(IntervalSource.LESSON).stream()
                .map(Interval::getRecordId)
                .collect(Collectors.toList());

        if (lessonIds.isEmpty()) {
            return SlotOpeningCheck.clear();
        }
        log.info("Opening refused - teacherId={}, date={}, {}~{} overlaps {}",
                teacherId, date, startTime, endTime,
                ConflictDetector.buildConflictSummary(result.conflictsFrom(IntervalSource.LESSON)));
        return SlotOpeningCheck.confirmedConflict(lessonIds);
    }
}

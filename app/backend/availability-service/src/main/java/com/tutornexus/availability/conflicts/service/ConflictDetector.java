package com.tutornexus.availability.conflicts.service;

import com.tutornexus.availability.common.util.ScheduleTimes;
import com.tutornexus.availability.conflicts.exception.ConflictCheckFailedException;
import com.tutornexus.availability.conflicts.fetcher.ConflictCandidateFetcher;
import com.tutornexus.availability.conflicts.fetcher.LessonCandidate;
import com.tutornexus.availability.conflicts.fetcher.OpenSlotCandidate;
import com.tutornexus.availability.overlap.algorithm.Interval;
import com.tutornexus.availability.overlap.algorithm.IntervalSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * Booking conflict detection.
 *
 * 1. Fetch the day's lessons and open slots in parallel
 * 2. Normalize both into {@link Interval}s, dropping cancelled lessons and excluded records
 * 3. Keep the ones overlapping the proposed range, sorted by start
 *
 * If either fetch fails the whole check fails; a partial candidate set could hide a real conflict.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConflictDetector {

    static final String DEFAULT_LESSON_LABEL = "Lesson";
    static final String OPEN_SLOT_LABEL = "Open slot";

    private final ConflictCandidateFetcher fetcher;

    /**
     * Blocking variant of {@link #checkAsync(ConflictQuery)}.
     *
     * @throws ConflictCheckFailedException if candidates could not be loaded
     */
    public ConflictCheckResult check(ConflictQuery query) {
        try {
            return checkAsync(query).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof ConflictCheckFailedException) {
                throw (ConflictCheckFailedException) e.getCause();
            }
            throw new ConflictCheckFailedException(e.getCause() != null ? e.getCause() : e);
        }
    }

    public CompletableFuture<ConflictCheckResult> checkAsync(ConflictQuery query) {
        validate(query);

        LocalDateTime dayStart = query.getDate().atStartOfDay();
        LocalDateTime dayEnd = query.getDate().atTime(LocalTime.MAX);
        String teacherId = query.getTeacherId();

        CompletableFuture<List<LessonCandidate>> lessons;
        CompletableFuture<List<OpenSlotCandidate>> openSlots;
        try {
            lessons = fetcher.getLessons(dayStart, dayEnd, teacherId);
            openSlots = fetcher.getOpenSlots(dayStart, dayEnd, teacherId);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(fail(query, e));
        }

        return lessons.thenCombine(openSlots, (lessonList, slotList) -> findConflicts(query, lessonList, slotList))
                .exceptionally(throwable -> {
                    throw fail(query, unwrap(throwable));
                });
    }

    /**
     * Pure part of the check: same candidates in, same conflicts out.
     */
    public ConflictCheckResult findConflicts(ConflictQuery query,
                                             List<LessonCandidate> lessons,
                                             List<OpenSlotCandidate> openSlots) {
        List<Interval> candidates = new ArrayList<>();
        nullSafe(lessons).stream()
                .map(lesson -> toInterval(lesson, query))
                .filter(Objects::nonNull)
                .forEach(candidates::add);
        nullSafe(openSlots).stream()
                .map(slot -> toInterval(slot, query))
                .filter(Objects::nonNull)
                .forEach(candidates::add);

        List<Interval> conflicts = candidates.stream()
                .filter(candidate -> candidate.overlaps(query.getStart(), query.getEnd()))
                .sorted()
                .collect(Collectors.toList());

        log.debug("Conflict check - teacherId={}, date={}, {}~{}, candidates={}, conflicts={}",
                query.getTeacherId(), query.getDate(), query.getStart().toLocalTime(),
                query.getEnd().toLocalTime(), candidates.size(), conflicts.size());

        return new ConflictCheckResult(conflicts);
    }

    /**
     * Short summary for logs and error messages, e.g.
     * "LESSON:rec1 10:00-11:00; SLOT:rec2 10:30-11:30"
     */
    public static String buildConflictSummary(List<Interval> conflicts) {
        return conflicts.stream()
                .map(conflict -> String.format("%s:%s %s-%s",
                        conflict.getSource(),
                        conflict.getRecordId(),
                        ScheduleTimes.formatTime(conflict.getStart().toLocalTime()),
                        ScheduleTimes.formatTime(conflict.getEnd().toLocalTime())))
                .collect(Collectors.joining("; "));
    }

    private Interval toInterval(LessonCandidate lesson, ConflictQuery query) {
        if (lesson.getStatus() != null && !lesson.getStatus().blocksTime()) {
            return null;
        }
        if (isExcluded(lesson.getId(), query)
                || query.getExcludeLinkedRecordIds().contains(lesson.getId())) {
            return null;
        }
        if (lesson.getDate() == null || lesson.getStartTime() == null) {
            log.warn("Skipping lesson without date/time: lessonId={}", lesson.getId());
            return null;
        }
        int duration = lesson.getDurationMinutes() == null || lesson.getDurationMinutes() <= 0
                ? 60 : lesson.getDurationMinutes();
        LocalDateTime start = lesson.getDate().atTime(lesson.getStartTime());
        return Interval.builder()
                .recordId(lesson.getId())
                .source(IntervalSource.LESSON)
                .start(start)
                .end(start.plusMinutes(duration))
                .label(lesson.getStudentName() != null && !lesson.getStudentName().isBlank()
                        ? lesson.getStudentName() : DEFAULT_LESSON_LABEL)
                .build();
    }

    private Interval toInterval(OpenSlotCandidate slot, ConflictQuery query) {
        if (isExcluded(slot.getId(), query)) {
            return null;
        }
        if (slot.getStart() == null || slot.getEnd() == null) {
            log.warn("Skipping open slot without start/end: slotId={}", slot.getId());
            return null;
        }
        return Interval.builder()
                .recordId(slot.getId())
                .source(IntervalSource.SLOT)
                .start(slot.getStart())
                .end(slot.getEnd())
                .label(OPEN_SLOT_LABEL)
                .build();
    }

    private static boolean isExcluded(String recordId, ConflictQuery query) {
        return query.getExcludeRecordId() != null && query.getExcludeRecordId().equals(recordId);
    }

    private static void validate(ConflictQuery query) {
        Objects.requireNonNull(query, "query");
        if (query.getDate() == null || query.getStart() == null || query.getEnd() == null) {
            throw new IllegalArgumentException("date, start and end are required");
        }
    }

    private ConflictCheckFailedException fail(ConflictQuery query, Throwable cause) {
        log.error("Conflict check failed - teacherId={}, date={}: {}",
                query.getTeacherId(), query.getDate(), cause.toString());
        return cause instanceof ConflictCheckFailedException
                ? (ConflictCheckFailedException) cause
                : new ConflictCheckFailedException(cause);
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }
}

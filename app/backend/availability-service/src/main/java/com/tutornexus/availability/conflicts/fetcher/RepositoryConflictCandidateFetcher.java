package com.tutornexus.availability.conflicts.fetcher;

import com.tutornexus.availability.common.config.ConflictCheckProperties;
import com.tutornexus.availability.common.entity.Lesson;
import com.tutornexus.availability.common.entity.SlotStatus;
import com.tutornexus.availability.common.repository.LessonRepository;
import com.tutornexus.availability.common.repository.SlotInventoryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Loads candidates from the local store on the conflict-check executor, with a per-fetch timeout.
 */
@Component
@Slf4j
public class RepositoryConflictCandidateFetcher implements ConflictCandidateFetcher {

    private final LessonRepository lessonRepository;
    private final SlotInventoryRepository slotInventoryRepository;
    private final Executor executor;
    private final ConflictCheckProperties properties;

    public RepositoryConflictCandidateFetcher(
            LessonRepository lessonRepository,
            SlotInventoryRepository slotInventoryRepository,
            @Qualifier("conflictCheckExecutor") Executor executor,
            ConflictCheckProperties properties
    ) {
        this.lessonRepository = lessonRepository;
        this.slotInventoryRepository = slotInventoryRepository;
        this.executor = executor;
        this.properties = properties;
    }

    @Override
    public CompletableFuture<List<LessonCandidate>> getLessons(LocalDateTime start, LocalDateTime end, String teacherId) {
        return CompletableFuture.supplyAsync(() -> loadLessons(start, end, teacherId), executor)
                .orTimeout(properties.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public CompletableFuture<List<OpenSlotCandidate>> getOpenSlots(LocalDateTime start, LocalDateTime end, String teacherId) {
        return CompletableFuture.supplyAsync(() -> loadOpenSlots(start, end, teacherId), executor)
                .orTimeout(properties.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    private List<LessonCandidate> loadLessons(LocalDateTime start, LocalDateTime end, String teacherId) {
        LocalDate from = start.toLocalDate();
        LocalDate to = end.toLocalDate();
        log.debug("Loading lesson candidates: {} ~ {}, teacherId={}", from, to, teacherId);

        List<Lesson> lessons = hasText(teacherId)
                ? lessonRepository.findByTeacherIdAndDateBetweenOrderByDateAscStartTimeAsc(teacherId, from, to)
                : lessonRepository.findByDateBetweenOrderByDateAscStartTimeAsc(from, to);

        return lessons.stream()
                .map(LessonCandidate::from)
                .collect(Collectors.toList());
    }

    private List<OpenSlotCandidate> loadOpenSlots(LocalDateTime start, LocalDateTime end, String teacherId) {
        LocalDate from = start.toLocalDate();
        LocalDate to = end.toLocalDate();
        log.debug("Loading open slot candidates: {} ~ {}, teacherId={}", from, to, teacherId);

        return from.datesUntil(to.plusDays(1))
                .flatMap(day -> (hasText(teacherId)
                        ? slotInventoryRepository.findByTeacherIdAndDateAndStatusOrderByStartTimeAsc(teacherId, day, SlotStatus.OPEN)
                        : slotInventoryRepository.findByDateAndStatusOrderByStartTimeAsc(day, SlotStatus.OPEN)).stream())
                .map(OpenSlotCandidate::from)
                .collect(Collectors.toList());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

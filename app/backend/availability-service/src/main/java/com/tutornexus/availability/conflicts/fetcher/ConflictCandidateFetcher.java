package com.tutornexus.availability.conflicts.fetcher;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Supplies conflict candidates for a time window.
 *
 * Implementations may filter by window, teacher and (for slots) the open status, nothing more.
 * A failed or timed-out fetch completes the future exceptionally.
 */
public interface ConflictCandidateFetcher {

    /**
     * @param teacherId null for all teachers
     */
    CompletableFuture<List<LessonCandidate>> getLessons(LocalDateTime start, LocalDateTime end, String teacherId);

    /**
     * @param teacherId null for all teachers
     */
    CompletableFuture<List<OpenSlotCandidate>> getOpenSlots(LocalDateTime start, LocalDateTime end, String teacherId);
}

package com.tutornexus.availability.common.repository;

import com.tutornexus.availability.common.entity.SlotInventory;
import com.tutornexus.availability.common.entity.SlotStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface SlotInventoryRepository extends JpaRepository<SlotInventory, Long> {

    Optional<SlotInventory> findByNaturalKey(String naturalKey);

    // Inclusive date range, ordered so the sync sees the same sequence every run
    List<SlotInventory> findByDateBetweenOrderByDateAscStartTimeAscSlotIdAsc(LocalDate from, LocalDate to);

    List<SlotInventory> findByTeacherIdAndDateBetweenOrderByDateAscStartTimeAscSlotIdAsc(
            String teacherId, LocalDate from, LocalDate to);

    // Open slots of one day (conflict candidates)
    List<SlotInventory> findByDateAndStatusOrderByStartTimeAsc(LocalDate date, SlotStatus status);

    List<SlotInventory> findByTeacherIdAndDateAndStatusOrderByStartTimeAsc(
            String teacherId, LocalDate date, SlotStatus status);

    // Slots holding a given lesson (reopening trigger)
    @Query("SELECT DISTINCT s FROM SlotInventory s JOIN s.linkedLessonIds l WHERE l = :lessonId")
    List<SlotInventory> findLinkingLesson(@Param("lessonId") String lessonId);
}

package com.tutornexus.availability.common.repository;

import com.tutornexus.availability.common.entity.Lesson;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

@Repository
public interface LessonRepository extends JpaRepository<Lesson, String> {

    List<Lesson> findByDateBetweenOrderByDateAscStartTimeAsc(LocalDate from, LocalDate to);

    List<Lesson> findByTeacherIdAndDateBetweenOrderByDateAscStartTimeAsc(
            String teacherId, LocalDate from, LocalDate to);

    // Fixed-lesson idempotency lookup
    boolean existsByTeacherIdAndDateAndStartTime(String teacherId, LocalDate date, LocalTime startTime);
}

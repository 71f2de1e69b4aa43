package com.tutornexus.availability.conflicts.fetcher;

import com.tutornexus.availability.common.entity.Lesson;
import com.tutornexus.availability.common.entity.LessonStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * A lesson as seen by conflict detection. Fetchers return every lesson in the window;
 * status filtering happens in the detector.
 */
@Value
@Builder
@AllArgsConstructor
public class LessonCandidate {
    String id;
    String teacherId;
    LocalDate date;
    LocalTime startTime;
    Integer durationMinutes;
    LessonStatus status;
    String studentName;

    public static LessonCandidate from(Lesson lesson) {
        return LessonCandidate.builder()
                .id(lesson.getLessonId())
                .teacherId(lesson.getTeacherId())
                .date(lesson.getDate())
                .startTime(lesson.getStartTime())
                .durationMinutes(lesson.getEffectiveDurationMinutes())
                .status(lesson.getStatus())
                .studentName(lesson.getStudentName())
                .build();
    }
}

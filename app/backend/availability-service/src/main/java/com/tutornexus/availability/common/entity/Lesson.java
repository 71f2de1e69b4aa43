package com.tutornexus.availability.common.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

@Entity
@Table(name = "lessons", indexes = {
    @Index(name = "idx_lesson_teacher_date", columnList = "teacher_id, lesson_date"),
    @Index(name = "idx_lesson_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Lesson {

    public static final int DEFAULT_DURATION_MINUTES = 60;

    @Id
    @Column(name = "lesson_id", length = 64)
    private String lessonId;

    @Column(name = "teacher_id", nullable = false, length = 64)
    private String teacherId;

    @Column(name = "student_id", length = 64)
    private String studentId;

    @Column(name = "student_name", length = 255)
    private String studentName;

    @Column(name = "lesson_date", nullable = false)
    private LocalDate date;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "duration_minutes")
    private Integer durationMinutes;

    @Convert(converter = LessonStatusConverter.class)
    @Column(nullable = false, length = 32)
    @Builder.Default
    private LessonStatus status = LessonStatus.SCHEDULED;

    @Column(name = "lesson_type", length = 20)
    private String lessonType;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public int getEffectiveDurationMinutes() {
        return durationMinutes == null || durationMinutes <= 0 ? DEFAULT_DURATION_MINUTES : durationMinutes;
    }
}

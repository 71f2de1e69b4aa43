package com.tutornexus.availability.common.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Recurring weekly availability of a teacher. Edited by staff; the sync engine only reads it.
 */
@Entity
@Table(name = "weekly_templates", indexes = {
    @Index(name = "idx_template_teacher_id", columnList = "teacher_id"),
    @Index(name = "idx_template_active", columnList = "is_active")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WeeklyTemplate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "template_id")
    private Long templateId;

    @Column(name = "teacher_id", nullable = false, length = 64)
    private String teacherId;

    /**
     * 0 = Sunday .. 6 = Saturday
     */
    @Column(name = "day_of_week", nullable = false)
    private Integer dayOfWeek;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(length = 20)
    private String type;

    @Column(name = "duration_minutes")
    private Integer durationMinutes;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean isActive = true;

    /**
     * Fixed templates are materialized as lessons for the reserved student instead of open slots.
     */
    @Column(name = "is_fixed", nullable = false)
    @Builder.Default
    private Boolean isFixed = false;

    @Column(name = "reserved_for_student_id", length = 64)
    private String reservedForStudentId;

    @Column(name = "reserved_for_student_name", length = 255)
    private String reservedForStudentName;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isActiveTemplate() {
        return !Boolean.FALSE.equals(isActive);
    }

    public boolean isFixedTemplate() {
        return Boolean.TRUE.equals(isFixed);
    }
}

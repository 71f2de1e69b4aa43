package com.tutornexus.availability.common.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One dated, bookable slot. Identity for sync purposes is the natural key, not the row id.
 */
@Entity
@Table(name = "slot_inventory", indexes = {
    @Index(name = "idx_slot_teacher_id", columnList = "teacher_id"),
    @Index(name = "idx_slot_date", columnList = "slot_date"),
    @Index(name = "idx_slot_status", columnList = "status")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uk_slot_natural_key", columnNames = {"natural_key"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SlotInventory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "slot_id")
    private Long slotId;

    @Column(name = "natural_key", nullable = false, length = 128)
    private String naturalKey;

    @Column(name = "teacher_id", nullable = false, length = 64)
    private String teacherId;

    @Column(name = "slot_date", nullable = false)
    private LocalDate date;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Convert(converter = SlotStatusConverter.class)
    @Column(nullable = false, length = 32)
    @Builder.Default
    private SlotStatus status = SlotStatus.OPEN;

    @Column(name = "created_from_template_id")
    private Long createdFromTemplateId;

    @Column(name = "lesson_type", length = 20)
    private String lessonType;

    @Column(name = "is_locked", nullable = false)
    @Builder.Default
    private Boolean isLocked = false;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "slot_inventory_lessons", joinColumns = @JoinColumn(name = "slot_id"))
    @Column(name = "lesson_id", length = 64)
    @Builder.Default
    private Set<String> linkedLessonIds = new LinkedHashSet<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}

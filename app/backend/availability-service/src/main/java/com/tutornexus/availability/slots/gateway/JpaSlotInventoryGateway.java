package com.tutornexus.availability.slots.gateway;

import com.tutornexus.availability.common.entity.SlotInventory;
import com.tutornexus.availability.common.entity.SlotStatus;
import com.tutornexus.availability.common.entity.WeeklyTemplate;
import com.tutornexus.availability.common.repository.SlotInventoryRepository;
import com.tutornexus.availability.common.repository.WeeklyTemplateRepository;
import com.tutornexus.availability.slots.algorithm.DateRange;
import com.tutornexus.availability.slots.algorithm.SlotSnapshot;
import com.tutornexus.availability.slots.exception.DuplicateSlotException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaSlotInventoryGateway implements SlotInventoryGateway {

    private final WeeklyTemplateRepository weeklyTemplateRepository;
    private final SlotInventoryRepository slotInventoryRepository;

    @Override
    @Transactional(readOnly = true)
    public List<WeeklyTemplate> listTemplates(String teacherId) {
        if (teacherId == null || teacherId.isBlank()) {
            return weeklyTemplateRepository.findByIsActiveTrueOrderByTemplateIdAsc();
        }
        return weeklyTemplateRepository.findByTeacherIdAndIsActiveTrueOrderByTemplateIdAsc(teacherId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<SlotSnapshot> listInventory(DateRange range, String teacherId) {
        List<SlotInventory> slots = teacherId == null || teacherId.isBlank()
                ? slotInventoryRepository.findByDateBetweenOrderByDateAscStartTimeAscSlotIdAsc(
                        range.getFrom(), range.getTo())
                : slotInventoryRepository.findByTeacherIdAndDateBetweenOrderByDateAscStartTimeAscSlotIdAsc(
                        teacherId, range.getFrom(), range.getTo());
        return toSnapshots(slots);
    }

    @Override
    @Transactional
    public SlotSnapshot createInstance(SlotInstanceFields fields) {
        SlotInventory slot = SlotInventory.builder()
                .naturalKey(fields.getNaturalKey())
                .teacherId(fields.getTeacherId())
                .date(fields.getDate())
                .startTime(fields.getStartTime())
                .endTime(fields.getEndTime())
                .status(fields.getStatus() != null ? fields.getStatus() : SlotStatus.OPEN)
                .createdFromTemplateId(fields.getCreatedFromTemplateId())
                .lessonType(fields.getLessonType())
                .isLocked(Boolean.TRUE.equals(fields.getLocked()))
                .linkedLessonIds(fields.getLinkedLessonIds() != null
                        ? new LinkedHashSet<>(fields.getLinkedLessonIds()) : new LinkedHashSet<>())
                .build();

        try {
            SlotInventory saved = slotInventoryRepository.saveAndFlush(slot);
            log.debug("Slot created: slotId={}, naturalKey={}", saved.getSlotId(), saved.getNaturalKey());
            return SlotSnapshot.from(saved);
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateSlotException(fields.getNaturalKey(), e);
        }
    }

    @Override
    @Transactional
    public SlotSnapshot updateInstance(Long id, SlotInstanceFields fields) {
        SlotInventory slot = slotInventoryRepository.findById(id)
                .orElseThrow(() -> new IllegalStateException("Slot not found: " + id));

        if (fields.getNaturalKey() != null) {
            slot.setNaturalKey(fields.getNaturalKey());
        }
        if (fields.getTeacherId() != null) {
            slot.setTeacherId(fields.getTeacherId());
        }
        if (fields.getDate() != null) {
            slot.setDate(fields.getDate());
        }
        if (fields.getStartTime() != null) {
            slot.setStartTime(fields.getStartTime());
        }
        if (fields.getEndTime() != null) {
            slot.setEndTime(fields.getEndTime());
        }
        if (fields.getStatus() != null) {
            slot.setStatus(fields.getStatus());
        }
        if (fields.getCreatedFromTemplateId() != null) {
            slot.setCreatedFromTemplateId(fields.getCreatedFromTemplateId());
        }
        if (fields.getLessonType() != null) {
            slot.setLessonType(fields.getLessonType());
        }
        if (fields.getLocked() != null) {
            slot.setIsLocked(fields.getLocked());
        }
        if (fields.getLinkedLessonIds() != null) {
            slot.getLinkedLessonIds().clear();
            slot.getLinkedLessonIds().addAll(fields.getLinkedLessonIds());
        }

        SlotInventory saved = slotInventoryRepository.saveAndFlush(slot);
        log.debug("Slot updated: slotId={}, status={}", saved.getSlotId(), saved.getStatus());
        return SlotSnapshot.from(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<SlotSnapshot> findByNaturalKey(String naturalKey) {
        return slotInventoryRepository.findByNaturalKey(naturalKey).map(SlotSnapshot::from);
    }

    @Override
    @Transactional(readOnly = true)
    public List<SlotSnapshot> findLinkingLesson(String lessonId) {
        return toSnapshots(slotInventoryRepository.findLinkingLesson(lessonId));
    }

    private List<SlotSnapshot> toSnapshots(List<SlotInventory> slots) {
        return slots.stream()
                .map(SlotSnapshot::from)
                .collect(Collectors.toList());
    }
}

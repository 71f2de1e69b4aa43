package com.tutornexus.availability.slots.service;

import com.tutornexus.availability.common.entity.SlotStatus;
import com.tutornexus.availability.slots.algorithm.SlotSnapshot;
import com.tutornexus.availability.slots.gateway.SlotInstanceFields;
import com.tutornexus.availability.slots.gateway.SlotInventoryGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Releases slots held by a cancelled lesson.
 * A slot goes back to OPEN once no lesson is linked to it any more.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlotReopeningService {

    private final SlotInventoryGateway gateway;

    /**
     * @return ids of the slots that were reopened
     */
    public List<Long> reopenForCancelledLesson(String lessonId) {
        if (lessonId == null || lessonId.isBlank()) {
            throw new IllegalArgumentException("lessonId is required");
        }

        List<SlotSnapshot> linkedSlots = gateway.findLinkingLesson(lessonId);
        log.info("Lesson cancelled: lessonId={}, linkedSlots={}", lessonId, linkedSlots.size());

        List<Long> reopened = new ArrayList<>();
        for (SlotSnapshot slot : linkedSlots) {
            try {
                Set<String> remaining = new LinkedHashSet<>(slot.getLinkedLessonIds());
                remaining.remove(lessonId);

                SlotInstanceFields.SlotInstanceFieldsBuilder fields = SlotInstanceFields.builder()
                        .linkedLessonIds(remaining);
                if (remaining.isEmpty()) {
                    fields.status(SlotStatus.OPEN);
                }
                gateway.updateInstance(slot.getId(), fields.build());

                if (remaining.isEmpty()) {
                    reopened.add(slot.getId());
                    log.info("Slot reopened: slotId={}, naturalKey={}", slot.getId(), slot.getNaturalKey());
                } else {
                    log.debug("Slot still held by {} lessons: slotId={}", remaining.size(), slot.getId());
                }
            } catch (RuntimeException e) {
                log.error("Failed to release slot: slotId={}, lessonId={}", slot.getId(), lessonId, e);
            }
        }
        return reopened;
    }
}

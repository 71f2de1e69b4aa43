package com.tutornexus.availability.slots.algorithm;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Compares generated drafts with the current inventory.
 *
 * - toCreate: drafts whose natural key has no existing slot
 * - toUpdate: unprotected slots whose teacher, date, times or source template drifted from the draft
 * - toDeactivate: unprotected slots no draft produced any more, whose template is no longer active
 *
 * Protected slots (locked, booked or blocked) never appear in any set.
 */
@Component
@Slf4j
public class DiffEngine {

    public InventoryDiff diff(List<SlotSnapshot> existingInventory,
                              List<SlotDraft> generated,
                              Set<Long> activeTemplateIds) {
        Map<String, SlotSnapshot> existingByKey = new LinkedHashMap<>();
        for (SlotSnapshot slot : existingInventory) {
            if (existingByKey.putIfAbsent(slot.getNaturalKey(), slot) != null) {
                log.warn("Duplicate natural key in inventory, keeping the first: naturalKey={}, ignoredId={}",
                        slot.getNaturalKey(), slot.getId());
            }
        }

        Map<String, SlotDraft> draftsByKey = new LinkedHashMap<>();
        for (SlotDraft draft : generated) {
            draftsByKey.putIfAbsent(draft.getNaturalKey(), draft);
        }

        List<SlotDraft> toCreate = new ArrayList<>();
        List<SlotUpdate> toUpdate = new ArrayList<>();
        for (SlotDraft draft : draftsByKey.values()) {
            SlotSnapshot existing = existingByKey.get(draft.getNaturalKey());
            if (existing == null) {
                toCreate.add(draft);
            } else if (!existing.isProtected() && differs(existing, draft)) {
                toUpdate.add(new SlotUpdate(existing, draft));
            }
        }

        Set<Long> activeIds = activeTemplateIds == null ? new HashSet<>() : activeTemplateIds;
        List<SlotSnapshot> toDeactivate = new ArrayList<>();
        for (SlotSnapshot existing : existingByKey.values()) {
            if (draftsByKey.containsKey(existing.getNaturalKey())) {
                continue;
            }
            if (existing.getCreatedFromTemplateId() != null
                    && !activeIds.contains(existing.getCreatedFromTemplateId())
                    && !existing.isProtected()) {
                toDeactivate.add(existing);
            }
        }

        return new InventoryDiff(toCreate, toUpdate, toDeactivate);
    }

    private boolean differs(SlotSnapshot existing, SlotDraft draft) {
        return !Objects.equals(existing.getTeacherId(), draft.getTeacherId())
                || !Objects.equals(existing.getDate(), draft.getDate())
                || !Objects.equals(existing.getStartTime(), draft.getStartTime())
                || !Objects.equals(existing.getEndTime(), draft.getEndTime())
                || !Objects.equals(existing.getCreatedFromTemplateId(), draft.getCreatedFromTemplateId());
    }
}

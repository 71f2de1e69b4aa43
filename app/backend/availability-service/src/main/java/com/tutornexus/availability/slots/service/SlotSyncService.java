package com.tutornexus.availability.slots.service;

import com.tutornexus.availability.common.config.SlotSyncProperties;
import com.tutornexus.availability.common.entity.SlotStatus;
import com.tutornexus.availability.common.entity.WeeklyTemplate;
import com.tutornexus.availability.slots.algorithm.DiffEngine;
import com.tutornexus.availability.slots.algorithm.InventoryDiff;
import com.tutornexus.availability.slots.algorithm.InventoryOverlap;
import com.tutornexus.availability.slots.algorithm.InventoryOverlapDetector;
import com.tutornexus.availability.slots.algorithm.SlotDraft;
import com.tutornexus.availability.slots.algorithm.SlotSnapshot;
import com.tutornexus.availability.slots.algorithm.SlotUpdate;
import com.tutornexus.availability.slots.algorithm.SyncWindow;
import com.tutornexus.availability.slots.algorithm.TemplateExpander;
import com.tutornexus.availability.slots.dto.SlotSyncRequest;
import com.tutornexus.availability.slots.dto.SlotSyncResult;
import com.tutornexus.availability.slots.dto.SyncError;
import com.tutornexus.availability.slots.exception.DuplicateSlotException;
import com.tutornexus.availability.slots.exception.SlotSyncException;
import com.tutornexus.availability.slots.gateway.SlotInstanceFields;
import com.tutornexus.availability.slots.gateway.SlotInventoryGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Template to inventory sync.
 *
 * 1. Load templates and the inventory of the window (failure here aborts the run)
 * 2. Report overlapping slots already in the inventory
 * 3. Expand templates, diff against the inventory
 * 4. Apply item by item; a failed item becomes a SyncError and the run goes on
 *
 * Slots are never deleted: a slot whose template went away is set to BLOCKED.
 * Running twice with unchanged templates changes nothing the second time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlotSyncService {

    private final SlotInventoryGateway gateway;
    private final TemplateExpander templateExpander;
    private final DiffEngine diffEngine;
    private final InventoryOverlapDetector overlapDetector;
    private final SlotOpeningGuard openingGuard;
    private final SlotSyncProperties properties;
    private final Clock clock;

    /**
     * @throws SlotSyncException if templates or inventory cannot be loaded
     */
    public SlotSyncResult run(SlotSyncRequest request) {
        SlotSyncRequest effective = request != null ? request : new SlotSyncRequest();
        LocalDate startDate = effective.getStartDate() != null ? effective.getStartDate() : LocalDate.now(clock);
        int daysAhead = effective.getDaysAhead() != null ? effective.getDaysAhead() : properties.getDaysAhead();
        String teacherId = effective.getTeacherId() == null || effective.getTeacherId().isBlank()
                ? null : effective.getTeacherId();

        SyncWindow window = SyncWindow.of(startDate, daysAhead);
        log.info("Slot sync started - window={}~{}, teacherId={}",
                window.getWeekStart(), window.getEnd(), teacherId != null ? teacherId : "ALL");

        List<WeeklyTemplate> templates;
        List<SlotSnapshot> inventory;
        try {
            templates = gateway.listTemplates(teacherId);
            inventory = gateway.listInventory(window.toDateRange(), teacherId);
        } catch (RuntimeException e) {
            log.error("Slot sync aborted: failed to load templates or inventory", e);
            throw new SlotSyncException("Failed to load templates or inventory for "
                    + window.getWeekStart() + "~" + window.getEnd(), e);
        }

        List<InventoryOverlap> overlaps = overlapDetector.detectOverlaps(inventory);
        overlaps.forEach(overlap -> log.warn("Overlapping slots in inventory: {}", overlap.describe()));

        List<SlotDraft> drafts = templateExpander.generateInstances(templates, window);
        Set<Long> activeTemplateIds = templates.stream()
                .filter(WeeklyTemplate::isActiveTemplate)
                .map(WeeklyTemplate::getTemplateId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());

        InventoryDiff diff = diffEngine.diff(inventory, drafts, activeTemplateIds);
        log.debug("Diff - templates={}, drafts={}, inventory={}, toCreate={}, toUpdate={}, toDeactivate={}",
                templates.size(), drafts.size(), inventory.size(),
                diff.getToCreate().size(), diff.getToUpdate().size(), diff.getToDeactivate().size());

        List<SyncError> errors = new ArrayList<>();
        int created = 0;
        int updated = 0;
        int deactivated = 0;

        for (SlotDraft draft : diff.getToCreate()) {
            if (create(draft, errors)) {
                created++;
            }
        }
        for (SlotUpdate update : diff.getToUpdate()) {
            if (update(update, errors)) {
                updated++;
            }
        }
        for (SlotSnapshot slot : diff.getToDeactivate()) {
            if (deactivate(slot, errors)) {
                deactivated++;
            }
        }

        SlotSyncResult result = SlotSyncResult.builder()
                .windowStart(window.getWeekStart())
                .windowEnd(window.getEnd())
                .created(created)
                .updated(updated)
                .deactivated(deactivated)
                .overlapsDetected(overlaps.size())
                .errors(errors)
                .build();

        log.info("Slot sync finished - window={}~{}, created={}, updated={}, deactivated={}, errors={}, overlaps={}",
                result.getWindowStart(), result.getWindowEnd(), created, updated, deactivated,
                errors.size(), overlaps.size());
        return result;
    }

    private boolean create(SlotDraft draft, List<SyncError> errors) {
        try {
            if (isRefusedByGuard(draft, Set.of(), errors)) {
                return false;
            }
            gateway.createInstance(SlotInstanceFields.builder()
                    .naturalKey(draft.getNaturalKey())
                    .teacherId(draft.getTeacherId())
                    .date(draft.getDate())
                    .startTime(draft.getStartTime())
                    .endTime(draft.getEndTime())
                    .status(SlotStatus.OPEN)
                    .createdFromTemplateId(draft.getCreatedFromTemplateId())
                    .lessonType(draft.getType())
                    .build());
            return true;
        } catch (DuplicateSlotException e) {
            // created concurrently by another run
            Optional<SlotSnapshot> existing = findQuietly(draft.getNaturalKey());
            if (existing.isPresent()) {
                log.info("Slot already created by a concurrent run: naturalKey={}", draft.getNaturalKey());
                return false;
            }
            log.error("Failed to create slot: naturalKey={}", draft.getNaturalKey(), e);
            errors.add(SyncError.applyFailed(draft.getNaturalKey(), e));
            return false;
        } catch (RuntimeException e) {
            log.error("Failed to create slot: naturalKey={}", draft.getNaturalKey(), e);
            errors.add(SyncError.applyFailed(draft.getNaturalKey(), e));
            return false;
        }
    }

    private boolean update(SlotUpdate update, List<SyncError> errors) {
        SlotSnapshot existing = update.getExisting();
        SlotDraft draft = update.getDraft();
        try {
            if (existing.getStatus() == SlotStatus.OPEN && update.changesTime()
                    && isRefusedByGuard(draft, existing.getLinkedLessonIds(), errors)) {
                return false;
            }
            gateway.updateInstance(existing.getId(), SlotInstanceFields.builder()
                    .teacherId(draft.getTeacherId())
                    .date(draft.getDate())
                    .startTime(draft.getStartTime())
                    .endTime(draft.getEndTime())
                    .createdFromTemplateId(draft.getCreatedFromTemplateId())
                    .lessonType(draft.getType())
                    .build());
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to update slot: slotId={}, naturalKey={}", existing.getId(), existing.getNaturalKey(), e);
            errors.add(SyncError.applyFailed(existing.getNaturalKey(), e));
            return false;
        }
    }

    private boolean deactivate(SlotSnapshot slot, List<SyncError> errors) {
        try {
            gateway.updateInstance(slot.getId(), SlotInstanceFields.builder()
                    .status(SlotStatus.BLOCKED)
                    .build());
            log.debug("Slot deactivated: slotId={}, naturalKey={}, templateId={}",
                    slot.getId(), slot.getNaturalKey(), slot.getCreatedFromTemplateId());
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to deactivate slot: slotId={}, naturalKey={}", slot.getId(), slot.getNaturalKey(), e);
            errors.add(SyncError.applyFailed(slot.getNaturalKey(), e));
            return false;
        }
    }

    /**
     * Runs the opening check; records a CONFLICT error and returns true when the slot must not open.
     * An unavailable check lets the slot open.
     */
    private boolean isRefusedByGuard(SlotDraft draft, Set<String> linkedLessonIds, List<SyncError> errors) {
        if (!properties.isOpeningGuardEnabled()) {
            return false;
        }
        SlotOpeningCheck check = openingGuard.check(draft.getTeacherId(), draft.getDate(),
                draft.getStartTime(), draft.getEndTime(), linkedLessonIds);
        if (check.isConfirmedConflict()) {
            errors.add(SyncError.conflict(draft.getNaturalKey(), check.getConflictingLessonIds()));
            return true;
        }
        if (check.isCheckUnavailable()) {
            log.warn("Opening slot without overlap check: naturalKey={}", draft.getNaturalKey());
        }
        return false;
    }

    private Optional<SlotSnapshot> findQuietly(String naturalKey) {
        try {
            return gateway.findByNaturalKey(naturalKey);
        } catch (RuntimeException e) {
            log.warn("Re-read after duplicate key failed: naturalKey={}", naturalKey, e);
            return Optional.empty();
        }
    }
}

package com.tutornexus.availability.slots.gateway;

import com.tutornexus.availability.common.entity.WeeklyTemplate;
import com.tutornexus.availability.slots.algorithm.DateRange;
import com.tutornexus.availability.slots.algorithm.SlotSnapshot;
import com.tutornexus.availability.slots.exception.DuplicateSlotException;

import java.util.List;
import java.util.Optional;

/**
 * Storage seam of the sync engine. Everything the engine reads or writes about templates and
 * slot inventory goes through here.
 */
public interface SlotInventoryGateway {

    /**
     * @param teacherId null for all teachers
     */
    List<WeeklyTemplate> listTemplates(String teacherId);

    /**
     * @param range     inclusive date range
     * @param teacherId null for all teachers
     */
    List<SlotSnapshot> listInventory(DateRange range, String teacherId);

    /**
     * @throws DuplicateSlotException if a slot with the same natural key already exists
     */
    SlotSnapshot createInstance(SlotInstanceFields fields);

    SlotSnapshot updateInstance(Long id, SlotInstanceFields fields);

    Optional<SlotSnapshot> findByNaturalKey(String naturalKey);

    List<SlotSnapshot> findLinkingLesson(String lessonId);
}

package com.tutornexus.availability.slots.service;

import com.tutornexus.availability.slots.exception.SlotOpeningConflictException;
import lombok.Value;

import java.util.List;

/**
 * Result of the lesson-overlap check done before a slot is opened.
 * A failed check is never reported as "no conflict".
 */
@Value
public class SlotOpeningCheck {

    public enum Outcome {
        CLEAR,
        CONFIRMED_CONFLICT,
        CHECK_UNAVAILABLE
    }

    Outcome outcome;
    List<String> conflictingLessonIds;
    String reason;

    public static SlotOpeningCheck clear() {
        return new SlotOpeningCheck(Outcome.CLEAR, List.of(), null);
    }

    public static SlotOpeningCheck confirmedConflict(List<String> lessonIds) {
        return new SlotOpeningCheck(Outcome.CONFIRMED_CONFLICT, List.copyOf(lessonIds), null);
    }

    public static SlotOpeningCheck checkUnavailable(String reason) {
        return new SlotOpeningCheck(Outcome.CHECK_UNAVAILABLE, List.of(), reason);
    }

    public boolean isConfirmedConflict() {
        return outcome == Outcome.CONFIRMED_CONFLICT;
    }

    public boolean isCheckUnavailable() {
        return outcome == Outcome.CHECK_UNAVAILABLE;
    }

    /**
     * @throws SlotOpeningConflictException on a confirmed conflict
     */
    public void requireNoConflict(String naturalKey) {
        if (isConfirmedConflict()) {
            throw new SlotOpeningConflictException(naturalKey, conflictingLessonIds);
        }
    }
}

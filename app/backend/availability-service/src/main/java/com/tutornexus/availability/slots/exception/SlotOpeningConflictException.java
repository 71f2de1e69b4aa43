package com.tutornexus.availability.slots.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class SlotOpeningConflictException extends RuntimeException {

    private final String naturalKey;
    private final List<String> conflictingLessonIds;

    public SlotOpeningConflictException(String naturalKey, List<String> conflictingLessonIds) {
        super("Cannot open slot " + naturalKey + ": overlaps lessons " + conflictingLessonIds);
        this.naturalKey = naturalKey;
        this.conflictingLessonIds = List.copyOf(conflictingLessonIds);
    }
}

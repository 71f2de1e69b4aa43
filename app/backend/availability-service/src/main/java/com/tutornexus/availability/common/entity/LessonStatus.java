package com.tutornexus.availability.common.entity;

import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;

/**
 * Lesson status with its stored (Hebrew) label.
 *
 * Unrecognised stored values read as {@link #SCHEDULED}: anything that is not a cancellation
 * still occupies the teacher's time.
 */
@Slf4j
public enum LessonStatus {
    SCHEDULED("מתוכנן", "scheduled"),
    COMPLETED("הסתיים", "completed"),
    CANCELLED("בוטל", "cancelled"),
    PENDING("ממתין", "pending"),
    NO_SHOW("לא הופיע", "no_show"),
    PENDING_CANCEL("ממתין לאישור ביטול", "pending_cancel");

    private final String storedValue;
    private final String code;

    LessonStatus(String storedValue, String code) {
        this.storedValue = storedValue;
        this.code = code;
    }

    public String getStoredValue() {
        return storedValue;
    }

    /**
     * Cancelled and pending-cancel lessons no longer occupy the teacher's time.
     */
    public boolean blocksTime() {
        return this != CANCELLED && this != PENDING_CANCEL;
    }

    public static LessonStatus fromStored(String raw) {
        if (raw == null || raw.isBlank()) {
            return SCHEDULED;
        }
        String trimmed = raw.trim();
        return Arrays.stream(values())
                .filter(status -> status.storedValue.equals(trimmed) || status.code.equalsIgnoreCase(trimmed))
                .findFirst()
                .orElseGet(() -> {
                    log.warn("Unknown lesson status '{}', treating it as {}", raw, SCHEDULED);
                    return SCHEDULED;
                });
    }
}

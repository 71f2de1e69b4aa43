package com.tutornexus.availability.slots.algorithm;

import com.tutornexus.availability.common.util.ScheduleTimes;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Idempotency key of a dated slot (and of a materialized fixed lesson):
 * {teacherId}|{YYYY-MM-DD}|{HH:mm}
 */
public final class NaturalKey {

    public static final String SEPARATOR = "|";

    private NaturalKey() {
    }

    public static String of(String teacherId, LocalDate date, LocalTime startTime) {
        if (teacherId == null || teacherId.isBlank() || date == null || startTime == null) {
            throw new IllegalArgumentException(String.format(
                    "Natural key needs teacherId, date and startTime (teacherId=%s, date=%s, startTime=%s)",
                    teacherId, date, startTime));
        }
        return teacherId + SEPARATOR + ScheduleTimes.formatDate(date) + SEPARATOR + ScheduleTimes.formatTime(startTime);
    }
}

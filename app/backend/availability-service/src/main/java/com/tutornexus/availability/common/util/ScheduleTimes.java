package com.tutornexus.availability.common.util;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Date and time helpers shared by the sync engine, conflict checks and rollover.
 * Weeks start on Sunday.
 */
public final class ScheduleTimes {

    public static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);
    public static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm");

    private ScheduleTimes() {
    }

    public static LocalDate weekStart(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY));
    }

    /**
     * Converts 0=Sunday..6=Saturday to {@link DayOfWeek}.
     */
    public static DayOfWeek toDayOfWeek(int sundayBasedDay) {
        if (sundayBasedDay < 0 || sundayBasedDay > 6) {
            throw new IllegalArgumentException("dayOfWeek must be 0..6 but was " + sundayBasedDay);
        }
        return sundayBasedDay == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(sundayBasedDay);
    }

    public static String formatDate(LocalDate date) {
        return date.format(DATE_FORMATTER);
    }

    public static String formatTime(LocalTime time) {
        return time.truncatedTo(ChronoUnit.MINUTES).format(TIME_FORMATTER);
    }

    /**
     * Accepts "HH:mm", "HH:mm:ss" or a full ISO local date-time. A bare time is placed on {@code date}.
     *
     * @throws IllegalArgumentException if the value cannot be parsed
     */
    public static LocalDateTime resolveDateTime(LocalDate date, String timeOrIso) {
        if (timeOrIso == null || timeOrIso.isBlank()) {
            throw new IllegalArgumentException("time is required");
        }
        String value = timeOrIso.trim();
        try {
            if (value.contains("T")) {
                return LocalDateTime.parse(value.length() > 19 ? value.substring(0, 19) : value);
            }
            return date.atTime(LocalTime.parse(value));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid time value: " + timeOrIso, e);
        }
    }
}

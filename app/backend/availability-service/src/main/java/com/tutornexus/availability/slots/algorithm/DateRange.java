package com.tutornexus.availability.slots.algorithm;

import lombok.Value;

import java.time.LocalDate;

/**
 * Inclusive date range
 */
@Value
public class DateRange {
    LocalDate from;
    LocalDate to;

    public DateRange(LocalDate from, LocalDate to) {
        if (from == null || to == null || to.isBefore(from)) {
            throw new IllegalArgumentException("Invalid date range: " + from + " ~ " + to);
        }
        this.from = from;
        this.to = to;
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(from) && !date.isAfter(to);
    }
}

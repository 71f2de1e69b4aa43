package com.tutornexus.availability.slots.algorithm;

import com.tutornexus.availability.common.util.ScheduleTimes;
import lombok.Value;

import java.time.LocalDate;

/**
 * Expansion horizon: from the Sunday of the start date through weekStart + daysAhead, inclusive.
 */
@Value
public class SyncWindow {
    LocalDate weekStart;
    int daysAhead;

    private SyncWindow(LocalDate weekStart, int daysAhead) {
        this.weekStart = weekStart;
        this.daysAhead = daysAhead;
    }

    public static SyncWindow of(LocalDate startDate, int daysAhead) {
        if (startDate == null) {
            throw new IllegalArgumentException("startDate is required");
        }
        if (daysAhead < 0) {
            throw new IllegalArgumentException("daysAhead must not be negative: " + daysAhead);
        }
        return new SyncWindow(ScheduleTimes.weekStart(startDate), daysAhead);
    }

    public LocalDate getEnd() {
        return weekStart.plusDays(daysAhead);
    }

    public DateRange toDateRange() {
        return new DateRange(weekStart, getEnd());
    }
}

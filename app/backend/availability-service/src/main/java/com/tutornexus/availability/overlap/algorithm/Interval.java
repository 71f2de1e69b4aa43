package com.tutornexus.availability.overlap.algorithm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Comparator;

/**
 * A lesson or slot reduced to the fields overlap checks need.
 */
@Value
@Builder
@AllArgsConstructor
public class Interval implements Comparable<Interval> {

    private static final Comparator<Interval> ORDER = Comparator
            .comparing(Interval::getStart)
            .thenComparing(Interval::getEnd)
            .thenComparing(Interval::getRecordId, Comparator.nullsFirst(Comparator.naturalOrder()));

    String recordId;
    IntervalSource source;
    LocalDateTime start;
    LocalDateTime end;
    String label;

    /**
     * Sorts by start, then end, then record id so equal-start results stay stable.
     */
    @Override
    public int compareTo(Interval other) {
        return ORDER.compare(this, other);
    }

    public boolean overlaps(LocalDateTime otherStart, LocalDateTime otherEnd) {
        return IntervalMath.overlaps(start, end, otherStart, otherEnd);
    }

    public long getDurationMinutes() {
        return Duration.between(start, end).toMinutes();
    }
}

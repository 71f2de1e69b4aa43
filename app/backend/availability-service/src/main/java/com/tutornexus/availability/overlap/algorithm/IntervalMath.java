package com.tutornexus.availability.overlap.algorithm;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Half-open interval overlap.
 *
 * [aStart, aEnd) and [bStart, bEnd) overlap iff aStart &lt; bEnd and aEnd &gt; bStart.
 * Ranges that only touch (aEnd == bStart) do not overlap, and a zero-length range overlaps
 * nothing, itself included. Every overlap decision in the service goes through this class.
 */
public final class IntervalMath {

    private IntervalMath() {
    }

    public static boolean overlaps(LocalDateTime aStart, LocalDateTime aEnd,
                                   LocalDateTime bStart, LocalDateTime bEnd) {
        Objects.requireNonNull(aStart, "aStart");
        Objects.requireNonNull(aEnd, "aEnd");
        Objects.requireNonNull(bStart, "bStart");
        Objects.requireNonNull(bEnd, "bEnd");
        return aStart.isBefore(bEnd) && aEnd.isAfter(bStart);
    }
}

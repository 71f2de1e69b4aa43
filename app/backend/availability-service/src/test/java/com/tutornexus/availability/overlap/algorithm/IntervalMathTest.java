package com.tutornexus.availability.overlap.algorithm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IntervalMath tests")
class IntervalMathTest {

    private static LocalDateTime at(int hour, int minute) {
        return LocalDateTime.of(2025, 1, 27, hour, minute);
    }

    @Test
    @DisplayName("Partially overlapping ranges overlap in both directions")
    void overlaps_partial_symmetric() {
        assertThat(IntervalMath.overlaps(at(10, 0), at(11, 0), at(10, 30), at(11, 30))).isTrue();
        assertThat(IntervalMath.overlaps(at(10, 30), at(11, 30), at(10, 0), at(11, 0))).isTrue();
    }

    @Test
    @DisplayName("Touching ranges do not overlap")
    void overlaps_touching() {
        assertThat(IntervalMath.overlaps(at(10, 0), at(11, 0), at(11, 0), at(12, 0))).isFalse();
        assertThat(IntervalMath.overlaps(at(11, 0), at(12, 0), at(10, 0), at(11, 0))).isFalse();
    }

    @Test
    @DisplayName("Containment counts as overlap")
    void overlaps_containment() {
        assertThat(IntervalMath.overlaps(at(9, 0), at(13, 0), at(10, 0), at(11, 0))).isTrue();
        assertThat(IntervalMath.overlaps(at(10, 0), at(11, 0), at(9, 0), at(13, 0))).isTrue();
    }

    @Test
    @DisplayName("A zero-length range overlaps nothing, itself included")
    void overlaps_zeroLength() {
        assertThat(IntervalMath.overlaps(at(10, 30), at(10, 30), at(10, 0), at(11, 0))).isFalse();
        assertThat(IntervalMath.overlaps(at(10, 30), at(10, 30), at(10, 30), at(10, 30))).isFalse();
    }

    @Test
    @DisplayName("Disjoint ranges do not overlap")
    void overlaps_disjoint() {
        assertThat(IntervalMath.overlaps(at(8, 0), at(9, 0), at(10, 0), at(11, 0))).isFalse();
    }

    @Test
    @DisplayName("Null bounds are rejected")
    void overlaps_nullBound() {
        assertThatThrownBy(() -> IntervalMath.overlaps(null, at(11, 0), at(10, 0), at(11, 0)))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Interval ordering - start, then end, then record id")
    void interval_ordering() {
        Interval late = Interval.builder().recordId("a").source(IntervalSource.LESSON)
                .start(at(11, 0)).end(at(12, 0)).build();
        Interval earlyLong = Interval.builder().recordId("b").source(IntervalSource.SLOT)
                .start(at(10, 0)).end(at(12, 0)).build();
        Interval earlyShort = Interval.builder().recordId("c").source(IntervalSource.LESSON)
                .start(at(10, 0)).end(at(11, 0)).build();

        assertThat(java.util.stream.Stream.of(late, earlyLong, earlyShort).sorted())
                .containsExactly(earlyShort, earlyLong, late);
        assertThat(earlyShort.getDurationMinutes()).isEqualTo(60);
    }
}

package com.tutornexus.availability.conflicts.service;

import com.tutornexus.availability.overlap.algorithm.Interval;
import com.tutornexus.availability.overlap.algorithm.IntervalSource;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

@Value
public class ConflictCheckResult {

    /**
     * Sorted by start ascending
     */
    List<Interval> conflicts;

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }

    public List<Interval> conflictsFrom(IntervalSource source) {
        return conflicts.stream()
                .filter(conflict -> conflict.getSource() == source)
                .collect(Collectors.toList());
    }
}

package com.tutornexus.availability.slots.algorithm;

import com.tutornexus.availability.overlap.algorithm.IntervalMath;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Diagnostic pass: pairs of slots of the same teacher and date whose ranges overlap.
 * Reported only; nothing is resolved automatically.
 */
@Component
public class InventoryOverlapDetector {

    private static final Comparator<SlotSnapshot> BY_START = Comparator
            .comparing(SlotSnapshot::getStartTime)
            .thenComparing(SlotSnapshot::getEndTime)
            .thenComparing(SlotSnapshot::getNaturalKey);

    public List<InventoryOverlap> detectOverlaps(List<SlotSnapshot> inventory) {
        // TreeMap keeps report order stable across runs
        Map<String, List<SlotSnapshot>> byTeacherAndDate = inventory.stream()
                .collect(Collectors.groupingBy(
                        slot -> slot.getTeacherId() + "|" + slot.getDate(),
                        TreeMap::new,
                        Collectors.toList()));

        List<InventoryOverlap> overlaps = new ArrayList<>();
        for (List<SlotSnapshot> group : byTeacherAndDate.values()) {
            List<SlotSnapshot> sorted = new ArrayList<>(group);
            sorted.sort(BY_START);

            for (int i = 0; i < sorted.size(); i++) {
                for (int j = i + 1; j < sorted.size(); j++) {
                    SlotSnapshot first = sorted.get(i);
                    SlotSnapshot second = sorted.get(j);
                    // sorted by start: once second starts at/after first ends, later ones do too
                    if (!second.getStart().isBefore(first.getEnd())) {
                        break;
                    }
                    if (IntervalMath.overlaps(first.getStart(), first.getEnd(), second.getStart(), second.getEnd())) {
                        overlaps.add(new InventoryOverlap(first, second));
                    }
                }
            }
        }
        return overlaps;
    }
}

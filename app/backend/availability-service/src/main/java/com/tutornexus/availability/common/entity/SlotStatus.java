package com.tutornexus.availability.common.entity;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Slot inventory status.
 *
 * The store keeps the Hebrew label, older rows may carry the English value or the legacy
 * "booked" alias. {@link #fromStored(String)} and {@link #getStoredValue()} are the only
 * translation points; everything past the persistence boundary works on the enum.
 */
public enum SlotStatus {
    OPEN("פתוח", "open"),
    CLOSED("סגור", "closed", "booked"),
    CANCELED("מבוטל", "canceled"),
    BLOCKED("חסום ע\"י מנהל", "blocked", "חסום");

    private static final Map<String, SlotStatus> BY_LABEL = Arrays.stream(values())
            .flatMap(status -> Arrays.stream(status.aliases)
                    .map(alias -> Map.entry(alias, status)))
            .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));

    private static final Map<String, SlotStatus> BY_STORED_VALUE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(SlotStatus::getStoredValue, Function.identity()));

    private final String storedValue;
    private final String[] aliases;

    SlotStatus(String storedValue, String... aliases) {
        this.storedValue = storedValue;
        this.aliases = aliases;
    }

    public String getStoredValue() {
        return storedValue;
    }

    /**
     * Unknown or missing values read as OPEN, matching how the inventory has always treated them.
     */
    public static SlotStatus fromStored(String raw) {
        if (raw == null || raw.isBlank()) {
            return OPEN;
        }
        String trimmed = raw.trim();
        SlotStatus status = BY_STORED_VALUE.get(trimmed);
        if (status != null) {
            return status;
        }
        return BY_LABEL.getOrDefault(trimmed.toLowerCase(), OPEN);
    }
}

package com.tutornexus.availability.overlap.algorithm;

/**
 * Where a normalized interval came from. Serialized as the wire names booking UIs already use.
 */
public enum IntervalSource {
    LESSON("lessons"),
    SLOT("slot_inventory");

    private final String wireName;

    IntervalSource(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}

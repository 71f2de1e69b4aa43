package com.tutornexus.availability.slots.algorithm;

import lombok.Value;

import java.util.List;

@Value
public class InventoryDiff {
    List<SlotDraft> toCreate;
    List<SlotUpdate> toUpdate;
    List<SlotSnapshot> toDeactivate;

    public boolean isEmpty() {
        return toCreate.isEmpty() && toUpdate.isEmpty() && toDeactivate.isEmpty();
    }
}

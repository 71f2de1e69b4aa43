package com.tutornexus.availability.slots.dto;

public enum SyncErrorType {
    VALIDATION,
    APPLY_FAILED,
    // opening the slot would overlap an existing lesson
    CONFLICT
}

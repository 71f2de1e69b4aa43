package com.tutornexus.availability.slots.exception;

import lombok.Getter;

/**
 * A slot with the same natural key already exists
 */
@Getter
public class DuplicateSlotException extends RuntimeException {

    private final String naturalKey;

    public DuplicateSlotException(String naturalKey, Throwable cause) {
        super("Slot already exists: " + naturalKey, cause);
        this.naturalKey = naturalKey;
    }
}

package com.tutornexus.availability.slots.exception;

/**
 * Fatal for a whole sync run (templates or inventory could not be loaded)
 */
public class SlotSyncException extends RuntimeException {

    public SlotSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}

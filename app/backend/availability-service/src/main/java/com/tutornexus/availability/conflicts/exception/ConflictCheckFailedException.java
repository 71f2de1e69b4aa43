package com.tutornexus.availability.conflicts.exception;

/**
 * Candidates could not be loaded, so no conflict answer can be given.
 * The message is fixed; the cause carries the detail for logs.
 */
public class ConflictCheckFailedException extends RuntimeException {

    public static final String USER_MESSAGE = "Failed to check for overlaps. Please try again.";

    public ConflictCheckFailedException(Throwable cause) {
        super(USER_MESSAGE, cause);
    }
}

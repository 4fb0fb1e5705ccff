package com.heronix.attendance.exception;

/**
 * Exception thrown when attendance was already taken for the same class, subject and time slot.
 */
public class SessionAlreadyExistsException extends RuntimeException {

    public SessionAlreadyExistsException(String message) {
        super(message);
    }

    public SessionAlreadyExistsException(String message, Throwable cause) {
        super(message, cause);
    }
}

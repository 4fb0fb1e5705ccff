package com.heronix.attendance.exception;

/**
 * Exception thrown when a capture session operation is not allowed in its current state.
 */
public class InvalidStateTransitionException extends RuntimeException {

    public InvalidStateTransitionException(String message) {
        super(message);
    }

    public InvalidStateTransitionException(String message, Throwable cause) {
        super(message, cause);
    }
}

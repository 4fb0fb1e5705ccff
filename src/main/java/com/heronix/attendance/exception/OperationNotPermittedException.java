package com.heronix.attendance.exception;

/**
 * Exception thrown when the caller may not perform an operation on an existing resource.
 */
public class OperationNotPermittedException extends RuntimeException {

    public OperationNotPermittedException(String message) {
        super(message);
    }

    public OperationNotPermittedException(String message, Throwable cause) {
        super(message, cause);
    }
}

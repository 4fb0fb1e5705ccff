package com.heronix.attendance.exception;

/**
 * Exception thrown when a request is malformed or violates a business rule on its inputs.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}

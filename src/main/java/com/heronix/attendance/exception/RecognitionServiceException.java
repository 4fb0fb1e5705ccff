package com.heronix.attendance.exception;

/**
 * Exception thrown when the face recognition service is unreachable or returns an unusable response.
 */
public class RecognitionServiceException extends RuntimeException {

    public RecognitionServiceException(String message) {
        super(message);
    }

    public RecognitionServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}

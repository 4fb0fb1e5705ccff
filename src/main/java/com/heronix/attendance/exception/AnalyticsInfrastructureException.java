package com.heronix.attendance.exception;

/**
 * Exception thrown when an analytics run cannot start at all, for example when the session's students cannot be enumerated.
 */
public class AnalyticsInfrastructureException extends RuntimeException {

    public AnalyticsInfrastructureException(String message) {
        super(message);
    }

    public AnalyticsInfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.heronix.attendance.exception;

/**
 * Exception thrown when no record of a submitted roster could be stored.
 * The session row is rolled back with it.
 */
public class SubmissionFailedException extends RuntimeException {

    private final int failureCount;

    public SubmissionFailedException(String message, int failureCount) {
        super(message);
        this.failureCount = failureCount;
    }

    public int getFailureCount() {
        return failureCount;
    }
}

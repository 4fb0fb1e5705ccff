package com.heronix.attendance.exception;

import com.heronix.attendance.model.dto.AssignmentConflictReport;

/**
 * Exception thrown when a teacher assignment duplicates an existing one, or
 * collides with another teacher's assignment and was not forced.
 */
public class EnrollmentConflictException extends RuntimeException {

    private final transient AssignmentConflictReport report;

    public EnrollmentConflictException(String message, AssignmentConflictReport report) {
        super(message);
        this.report = report;
    }

    public EnrollmentConflictException(String message) {
        this(message, null);
    }

    public AssignmentConflictReport getReport() {
        return report;
    }

    /**
     * True when only conflicts were found, so the request may be repeated with force.
     */
    public boolean isRequiresConfirmation() {
        return report != null && !report.hasDuplicates() && report.hasConflicts();
    }
}

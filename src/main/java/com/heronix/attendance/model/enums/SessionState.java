package com.heronix.attendance.model.enums;

/**
 * States of an attendance capture session.
 */
public enum SessionState {

    /**
     * Choosing semester, department, section and subject
     */
    FILTER,

    /**
     * Collecting classroom images
     */
    CAPTURE,

    /**
     * Reviewing the recognised roster before submission
     */
    REVIEW,

    /**
     * Roster persisted; terminal for this session instance
     */
    SUBMITTED
}

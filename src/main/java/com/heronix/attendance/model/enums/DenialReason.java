package com.heronix.attendance.model.enums;

/**
 * Why the authorization gate refused a teacher.
 */
public enum DenialReason {

    /**
     * No enrollment interval exists for the class and subject
     */
    NOT_ASSIGNED,

    /**
     * Every interval starts after the requested date
     */
    NOT_YET_ACTIVE,

    /**
     * Every interval completed before the requested date
     */
    ENDED
}

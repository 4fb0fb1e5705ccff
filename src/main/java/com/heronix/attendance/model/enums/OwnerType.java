package com.heronix.attendance.model.enums;

/**
 * Kind of person an enrollment interval belongs to.
 */
public enum OwnerType {

    /**
     * Teaching assignment
     */
    TEACHER,

    /**
     * Student enrolled for credit
     */
    STUDENT
}

package com.heronix.attendance.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of one student in one attendance session.
 */
public enum AttendanceStatus {

    PRESENT,

    ABSENT,

    /**
     * Absence with an accepted reason; counted with the attended sessions
     */
    EXCUSED,

    LATE;

    /**
     * Whether the status counts towards the session's present count.
     */
    public boolean countsAsAttended() {
        return this != ABSENT;
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static AttendanceStatus fromJson(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return AttendanceStatus.valueOf(value.trim().toUpperCase());
    }
}

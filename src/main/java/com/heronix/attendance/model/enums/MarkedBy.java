package com.heronix.attendance.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Who set an attendance record's status.
 */
public enum MarkedBy {

    /**
     * Taken from the recognition result
     */
    SYSTEM,

    /**
     * Set or corrected by the teacher
     */
    MANUAL;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static MarkedBy fromJson(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return MarkedBy.valueOf(value.trim().toUpperCase());
    }
}

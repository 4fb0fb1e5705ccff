package com.heronix.attendance.model.enums;

/**
 * Where a resolved day schedule came from.
 */
public enum ScheduleSource {

    /**
     * Date-specific timetable, locked once created
     */
    DATE_OVERRIDE,

    /**
     * Weekly default timetable
     */
    RECURRING
}

package com.heronix.attendance.exception;

import java.time.LocalDate;

/**
 * Exception thrown when date overrides are written for a date that already has them.
 */
public class TimetableLockedException extends RuntimeException {

    public TimetableLockedException(LocalDate date, String department, String section, Integer semester) {
        super(String.format("Timetable for %s-%s, Semester %d on %s is locked and cannot be modified",
                department, section, semester, date));
    }
}

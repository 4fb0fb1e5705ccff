package com.heronix.attendance.model.dto;

import java.time.LocalTime;

import com.heronix.attendance.model.enums.ScheduleSource;

/**
 * A period scheduled for a class on a concrete date.
 *
 * @param ordinal position on the daily grid, 0 for periods before the first period start
 */
public record ResolvedPeriod(
        String subject,
        LocalTime startTime,
        LocalTime endTime,
        int ordinal,
        ScheduleSource source
) {}

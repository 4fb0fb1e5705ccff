package com.heronix.attendance.model.dto;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;

/**
 * Timetable of a class for one date.
 *
 * @param dateOverride true when the periods come from date overrides, which also means the date is locked
 */
public record ResolvedSchedule(
        LocalDate date,
        DayOfWeek dayOfWeek,
        List<ResolvedPeriod> periods,
        boolean dateOverride
) {
    /**
     * Periods of the given subject, in start time order.
     */
    public List<ResolvedPeriod> periodsFor(String subject) {
        return periods.stream()
                .filter(p -> p.subject().equals(subject))
                .toList();
    }
}

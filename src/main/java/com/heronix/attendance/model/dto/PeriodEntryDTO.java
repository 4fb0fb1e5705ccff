package com.heronix.attendance.model.dto;

import java.time.LocalTime;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Subject and time range of one timetable period, as entered by an admin.
 */
public record PeriodEntryDTO(
        @NotBlank String subject,
        @NotNull LocalTime startTime,
        @NotNull LocalTime endTime
) {}

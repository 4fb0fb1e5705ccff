package com.heronix.attendance.model.dto;

import com.heronix.attendance.model.enums.AttendanceStatus;

import jakarta.validation.constraints.NotNull;

/**
 * Correction of one attendance record.
 */
public record RecordUpdateDTO(
        @NotNull Long recordId,
        @NotNull AttendanceStatus status,
        String reasonType
) {}

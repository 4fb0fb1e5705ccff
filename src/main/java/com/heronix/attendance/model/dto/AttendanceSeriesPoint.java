package com.heronix.attendance.model.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.heronix.attendance.model.enums.AttendanceStatus;

/**
 * One point of a student's attendance series for a subject, as sent to the inference stages.
 */
public record AttendanceSeriesPoint(
        AttendanceStatus status,
        BigDecimal confidence,
        String emotion,
        String attentiveness,
        @JsonProperty("marked_at") LocalDateTime markedAt,
        @JsonProperty("session_date") LocalDate sessionDate
) {}

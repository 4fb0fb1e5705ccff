package com.heronix.attendance.model.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

import com.heronix.attendance.model.enums.AttendanceStatus;
import com.heronix.attendance.model.enums.MarkedBy;

/**
 * One line of a student's attendance history.
 */
public record StudentHistoryEntry(
        Long recordId,
        Long sessionId,
        String subjectName,
        Integer semester,
        String classId,
        String sectionId,
        LocalDate sessionDate,
        LocalTime sessionTime,
        AttendanceStatus status,
        BigDecimal confidence,
        MarkedBy markedBy,
        LocalDateTime markedAt
) {}

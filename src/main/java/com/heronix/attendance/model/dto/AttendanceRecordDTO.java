package com.heronix.attendance.model.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.heronix.attendance.model.domain.AttendanceRecord;
import com.heronix.attendance.model.domain.Student;
import com.heronix.attendance.model.enums.AttendanceStatus;
import com.heronix.attendance.model.enums.MarkedBy;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for attendance records, with the student's identity resolved.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AttendanceRecordDTO {

    private Long id;
    private Long sessionId;
    private Long studentId;

    /**
     * USN of the student, null if the profile no longer exists.
     */
    private String usn;

    private String studentName;
    private AttendanceStatus status;
    private BigDecimal confidence;
    private String emotion;
    private String attentiveness;
    private String reasonType;
    private MarkedBy markedBy;
    private LocalDateTime markedAt;
    private LocalDateTime updatedAt;

    /**
     * Create from entity.
     */
    public static AttendanceRecordDTO fromEntity(AttendanceRecord record, Student student) {
        return AttendanceRecordDTO.builder()
                .id(record.getId())
                .sessionId(record.getSessionId())
                .studentId(record.getStudentId())
                .usn(student != null ? student.getUsn() : null)
                .studentName(student != null ? student.getName() : null)
                .status(record.getStatus())
                .confidence(record.getConfidence())
                .emotion(record.getEmotion())
                .attentiveness(record.getAttentiveness())
                .reasonType(record.getReasonType())
                .markedBy(record.getMarkedBy())
                .markedAt(record.getMarkedAt())
                .updatedAt(record.getUpdatedAt())
                .build();
    }
}

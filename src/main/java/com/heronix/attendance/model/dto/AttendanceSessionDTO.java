package com.heronix.attendance.model.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

import com.heronix.attendance.model.domain.AttendanceSession;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for attendance sessions.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AttendanceSessionDTO {

    private Long id;
    private Long teacherId;
    private String classId;
    private String sectionId;
    private String subjectName;
    private Integer semester;
    private LocalDate sessionDate;
    private LocalTime sessionTime;
    private LocalTime slotStart;
    private String capturedImagePath;
    private Integer totalStudents;
    private Integer presentCount;
    private Integer absentCount;
    private BigDecimal recognitionAccuracy;
    private LocalDateTime createdAt;

    /**
     * Create from entity.
     */
    public static AttendanceSessionDTO fromEntity(AttendanceSession session) {
        return AttendanceSessionDTO.builder()
                .id(session.getId())
                .teacherId(session.getTeacherId())
                .classId(session.getClassId())
                .sectionId(session.getSectionId())
                .subjectName(session.getSubjectName())
                .semester(session.getSemester())
                .sessionDate(session.getSessionDate())
                .sessionTime(session.getSessionTime())
                .slotStart(session.getSlotStart())
                .capturedImagePath(session.getCapturedImagePath())
                .totalStudents(session.getTotalStudents())
                .presentCount(session.getPresentCount())
                .absentCount(session.getAbsentCount())
                .recognitionAccuracy(session.getRecognitionAccuracy())
                .createdAt(session.getCreatedAt())
                .build();
    }
}

package com.heronix.attendance.model.domain;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.heronix.attendance.model.enums.AttendanceStatus;
import com.heronix.attendance.model.enums.MarkedBy;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Attendance Record - status of one student in one session.
 *
 * Records may be corrected on the day they were created only; every
 * correction is marked MANUAL.
 */
@Entity
@Table(name = "attendance_records",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_record_session_student", columnNames = {"session_id", "student_id"})
    },
    indexes = {
        @Index(name = "idx_ar_session", columnList = "session_id"),
        @Index(name = "idx_ar_student", columnList = "student_id")
    })
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AttendanceRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false)
    private Long sessionId;

    @Column(name = "student_id", nullable = false)
    private Long studentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    private AttendanceStatus status;

    /**
     * Recognition confidence (0-1) for system-marked records.
     */
    @Column(name = "confidence", precision = 5, scale = 4)
    private BigDecimal confidence;

    @Column(name = "emotion", length = 50)
    private String emotion;

    /**
     * Per-session attentiveness label from recognition (e.g., "High").
     */
    @Column(name = "attentiveness", length = 50)
    private String attentiveness;

    @Column(name = "reason_type", length = 100)
    private String reasonType;

    @Enumerated(EnumType.STRING)
    @Column(name = "marked_by", nullable = false, length = 10)
    @Builder.Default
    private MarkedBy markedBy = MarkedBy.SYSTEM;

    @Column(name = "marked_at", nullable = false)
    private LocalDateTime markedAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (markedAt == null) {
            markedAt = LocalDateTime.now();
        }
        if (markedBy == null) {
            markedBy = MarkedBy.SYSTEM;
        }
    }
}

package com.heronix.attendance.model.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Attendance Session - one concrete instance of attendance-taking for a
 * class, subject, date and time slot.
 *
 * Submissions for one teacher are serialised on the teacher row, and a new
 * session is refused when an existing one of the same class, subject and date
 * lies within the duplicate tolerance. uk_session_time only rejects a repeat
 * of the exact same submission time.
 *
 * @author Heronix Development Team
 */
@Entity
@Table(name = "attendance_sessions",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_session_time", columnNames = {
            "teacher_id", "class_id", "section_id", "subject_name", "session_date", "session_time"})
    },
    indexes = {
        @Index(name = "idx_as_lookup", columnList = "teacher_id, class_id, section_id, subject_name, session_date"),
        @Index(name = "idx_as_filters", columnList = "class_id, section_id, semester, subject_name"),
        @Index(name = "idx_as_date", columnList = "session_date")
    })
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AttendanceSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "teacher_id", nullable = false)
    private Long teacherId;

    /**
     * Department code of the class (e.g., "CS").
     */
    @Column(name = "class_id", nullable = false, length = 10)
    private String classId;

    @Column(name = "section_id", nullable = false, length = 10)
    private String sectionId;

    @Column(name = "subject_name", nullable = false, length = 100)
    private String subjectName;

    @Column(name = "semester", nullable = false)
    private Integer semester;

    @Column(name = "session_date", nullable = false)
    private LocalDate sessionDate;

    /**
     * Wall-clock time the roster was taken.
     */
    @Column(name = "session_time", nullable = false)
    private LocalTime sessionTime;

    /**
     * Start of the timetable period this session was taken for.
     */
    @Column(name = "slot_start", nullable = false)
    private LocalTime slotStart;

    /**
     * JSON array of stored annotated image paths.
     */
    @Column(name = "captured_image_path", length = 1000)
    private String capturedImagePath;

    @Column(name = "total_students", nullable = false)
    private Integer totalStudents;

    @Column(name = "present_count", nullable = false)
    private Integer presentCount;

    @Column(name = "absent_count", nullable = false)
    private Integer absentCount;

    @Column(name = "recognition_accuracy", precision = 5, scale = 2)
    private BigDecimal recognitionAccuracy;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}

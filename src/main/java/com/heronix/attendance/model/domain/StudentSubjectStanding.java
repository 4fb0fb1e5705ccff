package com.heronix.attendance.model.domain;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Student Subject Standing - cached output of the last successful analytics
 * run for a (student, subject, semester).
 *
 * Written only by the analytics pipeline, overwritten in place. Values are
 * the stage outputs as returned (e.g., "improving", "regular",
 * "moderately_attentive", "low") and may be stale or missing.
 */
@Entity
@Table(name = "student_subject_standings", uniqueConstraints = {
    @UniqueConstraint(name = "uk_standing_student_subject", columnNames = {"student_id", "subject", "semester"})
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StudentSubjectStanding {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", nullable = false)
    private Long studentId;

    @Column(name = "subject", nullable = false, length = 100)
    private String subject;

    @Column(name = "semester", nullable = false)
    private Integer semester;

    @Column(name = "trend", nullable = false, length = 50)
    private String trend;

    @Column(name = "consistency", nullable = false, length = 50)
    private String consistency;

    @Column(name = "attentiveness", nullable = false, length = 50)
    private String attentiveness;

    @Column(name = "risk", nullable = false, length = 50)
    private String risk;

    /**
     * Session whose submission triggered the run that produced these values.
     */
    @Column(name = "source_session_id")
    private Long sourceSessionId;

    @Column(name = "computed_at", nullable = false)
    private LocalDateTime computedAt;
}

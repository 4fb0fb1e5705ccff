package com.heronix.attendance.model.domain;

import java.time.LocalDate;
import java.time.LocalDateTime;

import com.heronix.attendance.model.enums.OwnerType;

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
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Enrollment Interval - a time-bounded assignment of a teacher or a student
 * to a (semester, department, section, subject) combination.
 *
 * Intervals are created by admin actions and never edited. A co-teaching
 * assignment is a second interval for the same combination, not a
 * replacement of the first.
 *
 * @author Heronix Development Team
 */
@Entity
@Table(name = "enrollment_intervals", indexes = {
    @Index(name = "idx_ei_owner", columnList = "owner_type, owner_id"),
    @Index(name = "idx_ei_combination", columnList = "semester, department, section, subject"),
    @Index(name = "idx_ei_owner_date", columnList = "owner_type, owner_id, enrollment_date")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EnrollmentInterval {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "owner_type", nullable = false, length = 10)
    private OwnerType ownerType;

    /**
     * Teacher id or student id, depending on ownerType.
     */
    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Min(1)
    @Max(8)
    @Column(name = "semester", nullable = false)
    private Integer semester;

    /**
     * Department code, also used as the class id (e.g., "CS").
     */
    @Column(name = "department", nullable = false, length = 10)
    private String department;

    @Column(name = "section", nullable = false, length = 10)
    private String section;

    @Column(name = "subject", nullable = false, length = 100)
    private String subject;

    @Column(name = "enrollment_date", nullable = false)
    private LocalDate enrollmentDate;

    /**
     * Last day of the assignment; open-ended when null.
     */
    @Column(name = "completion_date")
    private LocalDate completionDate;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    /**
     * Check whether the interval covers the given day.
     */
    public boolean isActiveOn(LocalDate date) {
        if (date.isBefore(enrollmentDate)) {
            return false;
        }
        return completionDate == null || !date.isAfter(completionDate);
    }

    /**
     * Check whether this interval shares at least one day with [from, to].
     * A null end on either side is open-ended.
     */
    public boolean overlaps(LocalDate from, LocalDate to) {
        boolean startsBeforeOtherEnds = to == null || !enrollmentDate.isAfter(to);
        boolean endsAfterOtherStarts = completionDate == null || !completionDate.isBefore(from);
        return startsBeforeOtherEnds && endsAfterOtherStarts;
    }

    public boolean sameCombination(Integer semester, String department, String section, String subject) {
        return this.semester.equals(semester)
                && this.department.equals(department)
                && this.section.equals(section)
                && this.subject.equals(subject);
    }
}

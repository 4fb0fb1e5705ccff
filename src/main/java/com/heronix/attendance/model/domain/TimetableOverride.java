package com.heronix.attendance.model.domain;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

import org.hibernate.annotations.Immutable;

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
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Date-specific timetable entry.
 *
 * When any override exists for (date, semester, department, section) the
 * weekly timetable is ignored for that date. Rows are insert-only: the
 * date stays locked until all of its overrides are deleted and recreated.
 */
@Immutable
@Entity
@Table(name = "timetable_overrides", indexes = {
    @Index(name = "idx_to_class_date", columnList = "period_date, semester, department, section")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class TimetableOverride {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "period_date", nullable = false, updatable = false)
    private LocalDate periodDate;

    /**
     * Weekday of periodDate, kept for display.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week", nullable = false, updatable = false, length = 10)
    private DayOfWeek dayOfWeek;

    @Column(name = "semester", nullable = false, updatable = false)
    private Integer semester;

    @Column(name = "department", nullable = false, updatable = false, length = 10)
    private String department;

    @Column(name = "section", nullable = false, updatable = false, length = 10)
    private String section;

    @Column(name = "subject", nullable = false, updatable = false, length = 100)
    private String subject;

    @Column(name = "start_time", nullable = false, updatable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false, updatable = false)
    private LocalTime endTime;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}

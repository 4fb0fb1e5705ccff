package com.heronix.attendance.model.domain;

import java.time.DayOfWeek;
import java.time.LocalTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Weekly default timetable entry for a class.
 *
 * Applies to every date falling on dayOfWeek unless that date has
 * its own {@link TimetableOverride} rows.
 */
@Entity
@Table(name = "timetable_periods", indexes = {
    @Index(name = "idx_tp_class_day", columnList = "semester, department, section, day_of_week")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RecurringPeriod {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "semester", nullable = false)
    private Integer semester;

    @Column(name = "department", nullable = false, length = 10)
    private String department;

    @Column(name = "section", nullable = false, length = 10)
    private String section;

    @Column(name = "subject", nullable = false, length = 100)
    private String subject;

    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week", nullable = false, length = 10)
    private DayOfWeek dayOfWeek;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;
}

package com.heronix.attendance.repository;

import java.time.LocalDate;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.heronix.attendance.model.domain.TimetableOverride;

/**
 * Repository for date-specific timetable overrides.
 */
@Repository
public interface TimetableOverrideRepository extends JpaRepository<TimetableOverride, Long> {

    List<TimetableOverride> findByPeriodDateAndSemesterAndDepartmentAndSectionOrderByStartTimeAsc(
            LocalDate periodDate, Integer semester, String department, String section);

    /**
     * Whether the date is locked for the class.
     */
    boolean existsByPeriodDateAndSemesterAndDepartmentAndSection(
            LocalDate periodDate, Integer semester, String department, String section);

    long deleteByPeriodDateAndSemesterAndDepartmentAndSection(
            LocalDate periodDate, Integer semester, String department, String section);
}

package com.heronix.attendance.repository;

import java.time.DayOfWeek;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.heronix.attendance.model.domain.RecurringPeriod;

/**
 * Repository for the weekly timetable.
 */
@Repository
public interface RecurringPeriodRepository extends JpaRepository<RecurringPeriod, Long> {

    List<RecurringPeriod> findBySemesterAndDepartmentAndSectionAndDayOfWeekOrderByStartTimeAsc(
            Integer semester, String department, String section, DayOfWeek dayOfWeek);

    /**
     * List with optional filters; null parameters match everything.
     */
    @Query("SELECT p FROM RecurringPeriod p WHERE "
            + "(:semester IS NULL OR p.semester = :semester) "
            + "AND (:department IS NULL OR p.department = :department) "
            + "AND (:section IS NULL OR p.section = :section) "
            + "AND (:dayOfWeek IS NULL OR p.dayOfWeek = :dayOfWeek) "
            + "ORDER BY p.dayOfWeek, p.startTime")
    List<RecurringPeriod> search(
            @Param("semester") Integer semester,
            @Param("department") String department,
            @Param("section") String section,
            @Param("dayOfWeek") DayOfWeek dayOfWeek);
}

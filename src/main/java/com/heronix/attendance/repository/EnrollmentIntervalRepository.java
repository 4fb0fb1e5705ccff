package com.heronix.attendance.repository;

import java.time.LocalDate;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.heronix.attendance.model.domain.EnrollmentInterval;
import com.heronix.attendance.model.enums.OwnerType;

/**
 * Repository for EnrollmentInterval entities.
 */
@Repository
public interface EnrollmentIntervalRepository extends JpaRepository<EnrollmentInterval, Long> {

    /**
     * All intervals of one owner for a (semester, department, section, subject) combination.
     */
    List<EnrollmentInterval> findByOwnerTypeAndOwnerIdAndSemesterAndDepartmentAndSectionAndSubject(
            OwnerType ownerType, Long ownerId, Integer semester,
            String department, String section, String subject);

    /**
     * All intervals of every owner of the given type for a combination.
     */
    List<EnrollmentInterval> findByOwnerTypeAndSemesterAndDepartmentAndSectionAndSubject(
            OwnerType ownerType, Integer semester, String department, String section, String subject);

    List<EnrollmentInterval> findByOwnerTypeAndOwnerIdOrderByEnrollmentDateDesc(OwnerType ownerType, Long ownerId);

    boolean existsByOwnerTypeAndOwnerIdAndSemester(OwnerType ownerType, Long ownerId, Integer semester);

    /**
     * Whether the owner already has an interval starting within [monthStart, monthEnd].
     */
    @Query("SELECT COUNT(e) > 0 FROM EnrollmentInterval e WHERE e.ownerType = :ownerType "
            + "AND e.ownerId = :ownerId AND e.enrollmentDate BETWEEN :monthStart AND :monthEnd")
    boolean existsStartingInRange(
            @Param("ownerType") OwnerType ownerType,
            @Param("ownerId") Long ownerId,
            @Param("monthStart") LocalDate monthStart,
            @Param("monthEnd") LocalDate monthEnd);
}

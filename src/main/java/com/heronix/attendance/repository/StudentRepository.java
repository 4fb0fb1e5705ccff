package com.heronix.attendance.repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.heronix.attendance.model.domain.Student;

/**
 * Repository for Student entities.
 */
@Repository
public interface StudentRepository extends JpaRepository<Student, Long> {

    /**
     * Find by university serial number.
     */
    Optional<Student> findByUsn(String usn);

    List<Student> findByUsnIn(Collection<String> usns);

    /**
     * Students holding an active enrollment interval for the class and subject on the given date.
     */
    @Query("SELECT s FROM Student s WHERE s.id IN ("
            + "SELECT e.ownerId FROM EnrollmentInterval e "
            + "WHERE e.ownerType = com.heronix.attendance.model.enums.OwnerType.STUDENT "
            + "AND e.semester = :semester AND e.department = :department "
            + "AND e.section = :section AND e.subject = :subject "
            + "AND e.enrollmentDate <= :asOf "
            + "AND (e.completionDate IS NULL OR e.completionDate >= :asOf)) "
            + "ORDER BY s.usn")
    List<Student> findEnrolled(
            @Param("semester") Integer semester,
            @Param("department") String department,
            @Param("section") String section,
            @Param("subject") String subject,
            @Param("asOf") LocalDate asOf);
}

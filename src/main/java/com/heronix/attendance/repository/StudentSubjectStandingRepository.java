package com.heronix.attendance.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.heronix.attendance.model.domain.StudentSubjectStanding;

/**
 * Repository for cached analytics standings.
 */
@Repository
public interface StudentSubjectStandingRepository extends JpaRepository<StudentSubjectStanding, Long> {

    Optional<StudentSubjectStanding> findByStudentIdAndSubjectAndSemester(
            Long studentId, String subject, Integer semester);

    List<StudentSubjectStanding> findByStudentIdOrderBySubjectAsc(Long studentId);
}

package com.heronix.attendance.repository;

import java.time.LocalDate;
import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.heronix.attendance.model.domain.AttendanceSession;

/**
 * Repository for AttendanceSession entities.
 */
@Repository
public interface AttendanceSessionRepository extends JpaRepository<AttendanceSession, Long> {

    /**
     * Sessions already taken by a teacher for a class and subject on a date.
     */
    List<AttendanceSession> findByTeacherIdAndClassIdAndSectionIdAndSubjectNameAndSessionDateOrderBySessionTimeAsc(
            Long teacherId, String classId, String sectionId, String subjectName, LocalDate sessionDate);

    /**
     * Sessions of a class and subject, optionally restricted to one date.
     */
    @Query("SELECT s FROM AttendanceSession s WHERE s.classId = :classId AND s.sectionId = :sectionId "
            + "AND s.semester = :semester AND s.subjectName = :subject "
            + "AND (:date IS NULL OR s.sessionDate = :date) "
            + "ORDER BY s.sessionDate DESC, s.sessionTime DESC")
    List<AttendanceSession> findForClass(
            @Param("classId") String classId,
            @Param("sectionId") String sectionId,
            @Param("semester") Integer semester,
            @Param("subject") String subject,
            @Param("date") LocalDate date);

    /**
     * Session listing with optional filters, newest first.
     */
    @Query("SELECT s FROM AttendanceSession s WHERE "
            + "(:teacherId IS NULL OR s.teacherId = :teacherId) "
            + "AND (:classId IS NULL OR s.classId = :classId) "
            + "AND (:sectionId IS NULL OR s.sectionId = :sectionId) "
            + "AND (:subject IS NULL OR s.subjectName = :subject) "
            + "AND (:date IS NULL OR s.sessionDate = :date) "
            + "ORDER BY s.sessionDate DESC, s.sessionTime DESC")
    List<AttendanceSession> search(
            @Param("teacherId") Long teacherId,
            @Param("classId") String classId,
            @Param("sectionId") String sectionId,
            @Param("subject") String subject,
            @Param("date") LocalDate date,
            Pageable pageable);
}

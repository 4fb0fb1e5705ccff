package com.heronix.attendance.repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.heronix.attendance.model.domain.AttendanceRecord;
import com.heronix.attendance.model.dto.AttendanceSeriesPoint;
import com.heronix.attendance.model.dto.StudentHistoryEntry;

/**
 * Repository for AttendanceRecord entities.
 */
@Repository
public interface AttendanceRecordRepository extends JpaRepository<AttendanceRecord, Long> {

    List<AttendanceRecord> findBySessionIdOrderByStudentIdAsc(Long sessionId);

    Optional<AttendanceRecord> findBySessionIdAndStudentId(Long sessionId, Long studentId);

    long countBySessionId(Long sessionId);

    /**
     * Distinct students holding a record in the session.
     */
    @Query("SELECT DISTINCT r.studentId FROM AttendanceRecord r WHERE r.sessionId = :sessionId ORDER BY r.studentId")
    List<Long> findDistinctStudentIdsBySessionId(@Param("sessionId") Long sessionId);

    /**
     * Attendance series of one student for one subject and semester, oldest session first.
     */
    @Query("SELECT new com.heronix.attendance.model.dto.AttendanceSeriesPoint("
            + "r.status, r.confidence, r.emotion, r.attentiveness, r.markedAt, s.sessionDate) "
            + "FROM AttendanceRecord r, AttendanceSession s "
            + "WHERE r.sessionId = s.id AND r.studentId = :studentId "
            + "AND s.subjectName = :subject AND s.semester = :semester "
            + "ORDER BY s.sessionDate ASC, s.sessionTime ASC")
    List<AttendanceSeriesPoint> findSeries(
            @Param("studentId") Long studentId,
            @Param("subject") String subject,
            @Param("semester") Integer semester);

    /**
     * Attendance history of a student with optional date and semester filters, newest first.
     */
    @Query("SELECT new com.heronix.attendance.model.dto.StudentHistoryEntry("
            + "r.id, s.id, s.subjectName, s.semester, s.classId, s.sectionId, s.sessionDate, "
            + "s.sessionTime, r.status, r.confidence, r.markedBy, r.markedAt) "
            + "FROM AttendanceRecord r, AttendanceSession s "
            + "WHERE r.sessionId = s.id AND r.studentId = :studentId "
            + "AND (:date IS NULL OR s.sessionDate = :date) "
            + "AND (:semester IS NULL OR s.semester = :semester) "
            + "ORDER BY s.sessionDate DESC, s.sessionTime DESC")
    List<StudentHistoryEntry> findHistory(
            @Param("studentId") Long studentId,
            @Param("date") LocalDate date,
            @Param("semester") Integer semester);
}

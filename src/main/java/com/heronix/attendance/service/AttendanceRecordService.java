package com.heronix.attendance.service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.attendance.config.AttendanceProperties;
import com.heronix.attendance.exception.InvalidRequestException;
import com.heronix.attendance.exception.OperationNotPermittedException;
import com.heronix.attendance.exception.ResourceNotFoundException;
import com.heronix.attendance.model.domain.AttendanceRecord;
import com.heronix.attendance.model.domain.AttendanceSession;
import com.heronix.attendance.model.domain.Student;
import com.heronix.attendance.model.dto.AttendanceRecordDTO;
import com.heronix.attendance.model.dto.AttendanceSessionDTO;
import com.heronix.attendance.model.dto.RecordUpdateDTO;
import com.heronix.attendance.model.dto.StudentHistoryEntry;
import com.heronix.attendance.model.enums.MarkedBy;
import com.heronix.attendance.repository.AttendanceRecordRepository;
import com.heronix.attendance.repository.AttendanceSessionRepository;
import com.heronix.attendance.repository.StudentRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Corrections of stored attendance and the read side of sessions and records.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AttendanceRecordService {

    private final AttendanceSessionRepository sessionRepository;
    private final AttendanceRecordRepository recordRepository;
    private final StudentRepository studentRepository;
    private final AttendanceProperties properties;
    private final Clock clock;

    /**
     * Result of a record correction.
     */
    public record UpdateResult(
            Long sessionId,
            int updatedCount,
            int presentCount,
            int absentCount
    ) {}

    /**
     * A session together with its records.
     */
    public record SessionRecords(
            AttendanceSessionDTO session,
            List<AttendanceRecordDTO> records
    ) {}

    /**
     * Correct records of a session. Only the session's teacher may do so,
     * and only on the day the records were taken. The session counts are
     * recomputed from all of its records afterwards.
     */
    @Transactional
    public UpdateResult updateRecords(Long teacherId, Long sessionId, List<RecordUpdateDTO> updates) {
        if (updates == null || updates.isEmpty()) {
            throw new InvalidRequestException("Session ID and attendance records are required");
        }

        AttendanceSession session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Session", sessionId));

        if (!session.getTeacherId().equals(teacherId)) {
            log.warn("Teacher {} tried to modify session {} owned by teacher {}",
                    teacherId, sessionId, session.getTeacherId());
            throw new OperationNotPermittedException("Not authorized to modify this session");
        }

        LocalDate today = LocalDate.now(clock);
        LocalDateTime now = LocalDateTime.now(clock);

        for (RecordUpdateDTO update : updates) {
            if (update.recordId() == null || update.status() == null) {
                throw new InvalidRequestException("Record ID and status are required for every correction");
            }
            AttendanceRecord record = recordRepository.findById(update.recordId())
                    .filter(r -> r.getSessionId().equals(sessionId))
                    .orElseThrow(() -> new ResourceNotFoundException(
                            "Record " + update.recordId() + " not found in session " + sessionId));

            if (!record.getMarkedAt().toLocalDate().equals(today)) {
                throw new OperationNotPermittedException("Can only edit attendance for today's date");
            }

            record.setStatus(update.status());
            record.setReasonType(update.reasonType());
            record.setMarkedBy(MarkedBy.MANUAL);
            record.setUpdatedAt(now);
        }

        List<AttendanceRecord> all = recordRepository.findBySessionIdOrderByStudentIdAsc(sessionId);
        int present = (int) all.stream().filter(r -> r.getStatus().countsAsAttended()).count();
        int absent = all.size() - present;

        session.setPresentCount(present);
        session.setAbsentCount(absent);
        if (session.getTotalStudents() < all.size()) {
            session.setTotalStudents(all.size());
        }
        sessionRepository.save(session);

        log.info("Teacher {} corrected {} record(s) of session {}: {} present, {} absent",
                teacherId, updates.size(), sessionId, present, absent);
        return new UpdateResult(sessionId, updates.size(), present, absent);
    }

    /**
     * Session listing with optional filters, newest first, capped at the configured limit.
     */
    @Transactional(readOnly = true)
    public List<AttendanceSessionDTO> listSessions(Long teacherId, String classId, String sectionId,
                                                   String subject, LocalDate date) {
        return sessionRepository.search(teacherId, classId, sectionId, subject, date,
                        PageRequest.of(0, properties.getSession().getListLimit()))
                .stream()
                .map(AttendanceSessionDTO::fromEntity)
                .toList();
    }

    /**
     * All sessions of a class and subject, optionally on one date, with their records.
     */
    @Transactional(readOnly = true)
    public List<SessionRecords> sessionsWithRecords(String classId, String sectionId, Integer semester,
                                                    String subject, LocalDate date) {
        return sessionRepository.findForClass(classId, sectionId, semester, subject, date)
                .stream()
                .map(s -> new SessionRecords(AttendanceSessionDTO.fromEntity(s), recordsOf(s.getId())))
                .toList();
    }

    @Transactional(readOnly = true)
    public SessionRecords getSession(Long sessionId) {
        AttendanceSession session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Session", sessionId));
        return new SessionRecords(AttendanceSessionDTO.fromEntity(session), recordsOf(sessionId));
    }

    /**
     * Attendance history of a student, newest first.
     */
    @Transactional(readOnly = true)
    public List<StudentHistoryEntry> studentHistory(Long studentId, LocalDate date, Integer semester) {
        if (!studentRepository.existsById(studentId)) {
            throw new ResourceNotFoundException("Student", studentId);
        }
        return recordRepository.findHistory(studentId, date, semester);
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private List<AttendanceRecordDTO> recordsOf(Long sessionId) {
        List<AttendanceRecord> records = recordRepository.findBySessionIdOrderByStudentIdAsc(sessionId);
        Set<Long> studentIds = records.stream().map(AttendanceRecord::getStudentId).collect(Collectors.toSet());
        Map<Long, Student> students = studentRepository.findAllById(studentIds).stream()
                .collect(Collectors.toMap(Student::getId, Function.identity()));

        return records.stream()
                .map(r -> AttendanceRecordDTO.fromEntity(r, students.get(r.getStudentId())))
                .toList();
    }
}

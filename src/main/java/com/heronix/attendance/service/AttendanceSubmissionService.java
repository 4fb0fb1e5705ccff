package com.heronix.attendance.service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.attendance.config.AttendanceProperties;
import com.heronix.attendance.exception.InvalidRequestException;
import com.heronix.attendance.exception.ResourceNotFoundException;
import com.heronix.attendance.exception.SessionAlreadyExistsException;
import com.heronix.attendance.exception.SubmissionFailedException;
import com.heronix.attendance.model.domain.AttendanceRecord;
import com.heronix.attendance.model.domain.AttendanceSession;
import com.heronix.attendance.model.domain.Student;
import com.heronix.attendance.model.dto.ResolvedPeriod;
import com.heronix.attendance.model.dto.RosterEntryDTO;
import com.heronix.attendance.model.dto.SessionSubmissionDTO;
import com.heronix.attendance.model.enums.MarkedBy;
import com.heronix.attendance.repository.AttendanceRecordRepository;
import com.heronix.attendance.repository.AttendanceSessionRepository;
import com.heronix.attendance.repository.StudentRepository;
import com.heronix.attendance.repository.TeacherRepository;
import com.heronix.attendance.service.event.AttendanceSubmittedEvent;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Persists a session and its roster in one transaction.
 *
 * Roster lines that cannot be stored (unknown USN, repeated student,
 * missing status) are skipped and counted; the session is kept as long as
 * at least one record was stored. Analytics are triggered through an
 * {@link AttendanceSubmittedEvent} that listeners only receive after commit.
 *
 * @author Heronix Development Team
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AttendanceSubmissionService {

    private final AttendanceSessionRepository sessionRepository;
    private final AttendanceRecordRepository recordRepository;
    private final StudentRepository studentRepository;
    private final TeacherRepository teacherRepository;
    private final TimetableService timetableService;
    private final AttendanceProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Submission outcome.
     */
    public record SubmissionResult(
            Long sessionId,
            int successCount,
            int failureCount,
            String message
    ) {
        public static SubmissionResult of(Long sessionId, int success, int failed) {
            String message = failed == 0
                    ? "Attendance submitted successfully"
                    : String.format("Attendance submitted with %d record(s) skipped", failed);
            return new SubmissionResult(sessionId, success, failed, message);
        }
    }

    /**
     * Store a session and its records.
     *
     * @throws SessionAlreadyExistsException if the time slot already has a session
     * @throws SubmissionFailedException if not a single record could be stored
     */
    @Transactional
    public SubmissionResult submit(Long teacherId, SessionSubmissionDTO submission) {
        validate(teacherId, submission);

        // held until commit, so concurrent submissions of one teacher see each other's sessions
        teacherRepository.findByIdForUpdate(teacherId)
                .orElseThrow(() -> new ResourceNotFoundException("Teacher", teacherId));

        LocalTime sessionTime = submission.getSessionTime().truncatedTo(ChronoUnit.SECONDS);
        LocalTime slotStart = resolveSlotStart(submission.getSessionDate(), submission.getSemester(),
                submission.getClassId(), submission.getSectionId(), submission.getSubjectName(), sessionTime);

        Optional<AttendanceSession> existing = findSessionInSlot(teacherId, submission.getClassId(),
                submission.getSectionId(), submission.getSubjectName(), submission.getSessionDate(),
                sessionTime);
        if (existing.isPresent()) {
            log.warn("Rejected duplicate submission by teacher {} for {} on {} at {} (session {})",
                    teacherId, submission.getSubjectName(), submission.getSessionDate(), sessionTime,
                    existing.get().getId());
            throw alreadyExists(submission);
        }

        AttendanceSession session = AttendanceSession.builder()
                .teacherId(teacherId)
                .classId(submission.getClassId())
                .sectionId(submission.getSectionId())
                .subjectName(submission.getSubjectName())
                .semester(submission.getSemester())
                .sessionDate(submission.getSessionDate())
                .sessionTime(sessionTime)
                .slotStart(slotStart)
                .capturedImagePath(submission.getCapturedImagePath())
                .totalStudents(submission.getTotalStudents())
                .presentCount(submission.getPresentCount())
                .absentCount(submission.getAbsentCount())
                .recognitionAccuracy(submission.getRecognitionAccuracy())
                .build();

        try {
            session = sessionRepository.saveAndFlush(session);
        } catch (DataIntegrityViolationException e) {
            log.warn("Repeated submission at {} of {} on {}",
                    sessionTime, submission.getSubjectName(), submission.getSessionDate());
            throw alreadyExists(submission);
        }

        List<AttendanceRecord> records = new ArrayList<>();
        int failed = buildRecords(session.getId(), submission.getRecords(), records);

        if (records.isEmpty()) {
            log.error("No record of session for {} on {} could be stored ({} failure(s)), rolling back",
                    submission.getSubjectName(), submission.getSessionDate(), failed);
            throw new SubmissionFailedException("No attendance record could be stored", failed);
        }

        recordRepository.saveAll(records);

        log.info("Session {} submitted by teacher {}: {} record(s) stored, {} failed",
                session.getId(), teacherId, records.size(), failed);

        eventPublisher.publishEvent(new AttendanceSubmittedEvent(
                session.getId(), teacherId, session.getSemester(), session.getSubjectName()));

        return SubmissionResult.of(session.getId(), records.size(), failed);
    }

    /**
     * Find a session of the teacher for the class, subject and date that falls in the
     * same time slot as the reference time.
     */
    @Transactional(readOnly = true)
    public Optional<AttendanceSession> findExistingSession(Long teacherId, Integer semester, String classId,
                                                           String sectionId, String subject, LocalDate date,
                                                           LocalTime referenceTime) {
        return findSessionInSlot(teacherId, classId, sectionId, subject, date, referenceTime);
    }

    /**
     * Start of the subject's timetable period nearest to the time when it lies within
     * the duplicate tolerance, otherwise the time itself at minute precision.
     * Informational only: duplicates are decided on sessionTime.
     */
    LocalTime resolveSlotStart(LocalDate date, Integer semester, String classId, String sectionId,
                               String subject, LocalTime time) {
        int tolerance = properties.getSession().getDuplicateSlotToleranceMinutes();

        return timetableService.resolve(date, semester, classId, sectionId)
                .periodsFor(subject)
                .stream()
                .map(ResolvedPeriod::startTime)
                .filter(start -> minutesBetween(start, time) <= tolerance)
                .min((a, b) -> Long.compare(minutesBetween(a, time), minutesBetween(b, time)))
                .orElse(time.truncatedTo(ChronoUnit.MINUTES));
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private Optional<AttendanceSession> findSessionInSlot(Long teacherId, String classId, String sectionId,
                                                          String subject, LocalDate date, LocalTime time) {
        int tolerance = properties.getSession().getDuplicateSlotToleranceMinutes();

        return sessionRepository
                .findByTeacherIdAndClassIdAndSectionIdAndSubjectNameAndSessionDateOrderBySessionTimeAsc(
                        teacherId, classId, sectionId, subject, date)
                .stream()
                .filter(s -> minutesBetween(s.getSessionTime(), time) <= tolerance)
                .findFirst();
    }

    private int buildRecords(Long sessionId, List<RosterEntryDTO> roster, List<AttendanceRecord> out) {
        Set<String> usns = roster.stream()
                .map(RosterEntryDTO::getUsn)
                .filter(u -> u != null && !u.isBlank())
                .collect(Collectors.toSet());
        Map<String, Student> studentsByUsn = studentRepository.findByUsnIn(usns).stream()
                .collect(Collectors.toMap(Student::getUsn, Function.identity()));

        Set<Long> seen = new HashSet<>();
        LocalDateTime markedAt = LocalDateTime.now(clock);
        int failed = 0;

        for (RosterEntryDTO entry : roster) {
            Student student = entry.getUsn() != null ? studentsByUsn.get(entry.getUsn()) : null;
            if (student == null) {
                log.warn("Student not found for USN {}, skipping", entry.getUsn());
                failed++;
                continue;
            }
            if (entry.getStatus() == null) {
                log.warn("No status given for {}, skipping", entry.getUsn());
                failed++;
                continue;
            }
            if (!seen.add(student.getId())) {
                log.warn("Student {} appears more than once in the roster, skipping repeat", entry.getUsn());
                failed++;
                continue;
            }

            out.add(AttendanceRecord.builder()
                    .sessionId(sessionId)
                    .studentId(student.getId())
                    .status(entry.getStatus())
                    .confidence(entry.getConfidence())
                    .emotion(entry.getEmotion())
                    .attentiveness(entry.getAttentiveness())
                    .reasonType(entry.getReasonType())
                    .markedBy(MarkedBy.SYSTEM)
                    .markedAt(markedAt)
                    .build());
        }
        return failed;
    }

    private void validate(Long teacherId, SessionSubmissionDTO submission) {
        if (teacherId == null) {
            throw new InvalidRequestException("Teacher identity is required");
        }
        if (submission.getClassId() == null || submission.getSectionId() == null
                || submission.getSubjectName() == null || submission.getSemester() == null
                || submission.getSessionDate() == null || submission.getSessionTime() == null
                || submission.getTotalStudents() == null || submission.getPresentCount() == null
                || submission.getAbsentCount() == null) {
            throw new InvalidRequestException("All fields are required");
        }
        if (submission.getRecords() == null || submission.getRecords().isEmpty()) {
            throw new InvalidRequestException("Attendance records are required");
        }
        if (submission.getPresentCount() + submission.getAbsentCount() > submission.getTotalStudents()) {
            throw new InvalidRequestException(String.format(
                    "Present (%d) and absent (%d) counts exceed total students (%d)",
                    submission.getPresentCount(), submission.getAbsentCount(), submission.getTotalStudents()));
        }
    }

    private static SessionAlreadyExistsException alreadyExists(SessionSubmissionDTO submission) {
        return new SessionAlreadyExistsException(String.format(
                "Attendance for %s on %s has already been taken for this time slot",
                submission.getSubjectName(), submission.getSessionDate()));
    }

    private static long minutesBetween(LocalTime a, LocalTime b) {
        return Math.abs(Duration.between(a, b).toMinutes());
    }
}

package com.heronix.attendance.lifecycle;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.heronix.attendance.adapter.recognition.FaceRecognitionClient;
import com.heronix.attendance.adapter.recognition.FaceRecognitionClient.EnrolledFace;
import com.heronix.attendance.adapter.recognition.FaceRecognitionClient.RecognitionResult;
import com.heronix.attendance.adapter.recognition.FaceRecognitionClient.RecognizedStudent;
import com.heronix.attendance.exception.AuthorizationDeniedException;
import com.heronix.attendance.exception.InvalidRequestException;
import com.heronix.attendance.exception.OperationNotPermittedException;
import com.heronix.attendance.exception.ResourceNotFoundException;
import com.heronix.attendance.exception.SessionAlreadyExistsException;
import com.heronix.attendance.exception.TimeWindowDeniedException;
import com.heronix.attendance.model.domain.AttendanceSession;
import com.heronix.attendance.model.domain.Student;
import com.heronix.attendance.model.dto.AuthorizationDecision;
import com.heronix.attendance.model.dto.ResolvedPeriod;
import com.heronix.attendance.model.dto.RosterEntryDTO;
import com.heronix.attendance.model.dto.SessionSubmissionDTO;
import com.heronix.attendance.model.dto.WindowCheck;
import com.heronix.attendance.model.enums.AttendanceStatus;
import com.heronix.attendance.model.enums.SessionState;
import com.heronix.attendance.repository.StudentRepository;
import com.heronix.attendance.service.AttendanceSubmissionService;
import com.heronix.attendance.service.AttendanceSubmissionService.SubmissionResult;
import com.heronix.attendance.service.AuthorizationGateService;
import com.heronix.attendance.service.TimeWindowService;
import com.heronix.attendance.service.TimetableService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives a capture session through FILTER -> CAPTURE -> REVIEW -> SUBMITTED.
 *
 * Open sessions live in memory only; nothing is persisted before submit.
 * A failed recognition keeps the session in CAPTURE and a failed
 * submission keeps it in REVIEW, so the teacher can retry. Cancel is
 * always possible and discards everything captured so far.
 *
 * @author Heronix Development Team
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionLifecycleService {

    private static final TypeReference<List<List<Double>>> EMBEDDINGS = new TypeReference<>() {};

    private final AuthorizationGateService authorizationGate;
    private final TimetableService timetableService;
    private final TimeWindowService timeWindowService;
    private final AttendanceSubmissionService submissionService;
    private final FaceRecognitionClient recognitionClient;
    private final StudentRepository studentRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<UUID, CaptureSession> sessions = new ConcurrentHashMap<>();

    /**
     * Snapshot of a capture session returned to callers.
     */
    public record CaptureSessionView(
            UUID id,
            SessionState state,
            Integer semester,
            String department,
            String section,
            String subject,
            LocalDate date,
            ResolvedPeriod period,
            int imageCount,
            int totalFacesDetected,
            int recognizedCount,
            List<RosterEntryDTO> roster,
            Long submittedSessionId
    ) {
        static CaptureSessionView of(CaptureSession s) {
            return new CaptureSessionView(s.getId(), s.getState(), s.getSemester(), s.getDepartment(),
                    s.getSection(), s.getSubject(), s.getDate(), s.getPeriod(), s.getImages().size(),
                    s.getTotalFacesDetected(), s.getRecognizedCount(), s.getRoster(), s.getSubmittedSessionId());
        }
    }

    /**
     * Outcome of a lifecycle submit.
     */
    public record SubmitOutcome(
            CaptureSessionView session,
            SubmissionResult result
    ) {}

    /**
     * FILTER -> CAPTURE.
     *
     * @throws AuthorizationDeniedException when the teacher is not enrolled for the class today
     * @throws TimeWindowDeniedException when the closest period's window is not open
     * @throws SessionAlreadyExistsException when the slot already has a session
     */
    public CaptureSessionView open(Long teacherId, Integer semester, String department, String section,
                                   String subject) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDate today = now.toLocalDate();

        AuthorizationDecision decision = authorizationGate.authorize(
                teacherId, semester, department, section, subject, today);
        if (!decision.authorized()) {
            log.info("Teacher {} denied for {} ({}-{}, sem {}): {}",
                    teacherId, subject, department, section, semester, decision.reason());
            throw new AuthorizationDeniedException(decision);
        }

        List<ResolvedPeriod> periods = timetableService.resolve(today, semester, department, section)
                .periodsFor(subject);
        ResolvedPeriod period = timeWindowService.selectClosest(now.toLocalTime(), periods)
                .orElseThrow(() -> new OperationNotPermittedException(String.format(
                        "No period of %s is scheduled today for %s-%s, Semester %d",
                        subject, department, section, semester)));

        WindowCheck window = timeWindowService.isWithinWindow(now.toLocalTime(), period);
        if (!window.allowed()) {
            throw new TimeWindowDeniedException(window);
        }

        Optional<AttendanceSession> existing = submissionService.findExistingSession(
                teacherId, semester, department, section, subject, today, period.startTime());
        if (existing.isPresent()) {
            throw new SessionAlreadyExistsException(String.format(
                    "Attendance for %s at %s has already been taken today (session %d)",
                    subject, period.startTime(), existing.get().getId()));
        }

        evictStale(today);

        CaptureSession session = new CaptureSession(teacherId, semester, department, section, subject,
                today, period, now);
        sessions.put(session.getId(), session);

        log.info("Teacher {} opened capture {} for {} period {} ({}-{}, sem {})",
                teacherId, session.getId(), subject, period.ordinal(), department, section, semester);
        return CaptureSessionView.of(session);
    }

    public CaptureSessionView get(Long teacherId, UUID id) {
        return CaptureSessionView.of(require(teacherId, id));
    }

    public CaptureSessionView addImages(Long teacherId, UUID id, List<String> images) {
        if (images == null || images.isEmpty()) {
            throw new InvalidRequestException("At least one image is required");
        }
        CaptureSession session = require(teacherId, id);
        session.addImages(images);
        log.debug("Capture {} now holds {} image(s)", id, session.getImages().size());
        return CaptureSessionView.of(session);
    }

    /**
     * CAPTURE -> REVIEW. Builds the draft roster from the recognition result:
     * recognized students present, every other enrolled student absent.
     */
    public CaptureSessionView recognize(Long teacherId, UUID id) {
        CaptureSession session = require(teacherId, id);
        session.requireState(SessionState.CAPTURE, "run recognition");
        if (session.getImages().isEmpty()) {
            throw new InvalidRequestException("At least one image is required");
        }

        List<Student> enrolled = studentRepository.findEnrolled(session.getSemester(), session.getDepartment(),
                session.getSection(), session.getSubject(), session.getDate());
        if (enrolled.isEmpty()) {
            throw new ResourceNotFoundException("No students enrolled in this class");
        }

        List<EnrolledFace> faces = enrolled.stream()
                .map(this::toEnrolledFace)
                .flatMap(Optional::stream)
                .toList();
        log.debug("{} of {} enrolled students have face embeddings", faces.size(), enrolled.size());
        if (faces.isEmpty()) {
            throw new InvalidRequestException(
                    "No students have registered face embeddings. Please register students with face images first.");
        }

        List<String> images = session.beginRecognition();
        RecognitionResult result;
        try {
            result = recognitionClient.recognize(images, faces);
        } catch (RuntimeException e) {
            session.failRecognition();
            throw e;
        }

        Map<String, RecognizedStudent> recognized = result.recognizedStudents().stream()
                .filter(r -> r.usn() != null)
                .collect(Collectors.toMap(RecognizedStudent::usn, Function.identity(), (a, b) -> a));

        List<RosterEntryDTO> draft = new ArrayList<>();
        for (Student student : enrolled) {
            RecognizedStudent match = recognized.get(student.getUsn());
            draft.add(match != null
                    ? RosterEntryDTO.builder()
                            .usn(student.getUsn())
                            .status(AttendanceStatus.PRESENT)
                            .confidence(match.confidence())
                            .emotion(match.emotion())
                            .attentiveness(match.attentiveness())
                            .build()
                    : RosterEntryDTO.builder()
                            .usn(student.getUsn())
                            .status(AttendanceStatus.ABSENT)
                            .build());
        }

        int matched = (int) draft.stream().filter(e -> e.getStatus() == AttendanceStatus.PRESENT).count();
        session.completeRecognition(draft, result.totalFacesDetected(), matched);

        log.info("Capture {} recognized {} of {} enrolled students", id, matched, enrolled.size());
        return CaptureSessionView.of(session);
    }

    /**
     * REVIEW -> SUBMITTED. Requires explicit confirmation; overrides replace
     * draft lines with the same USN.
     */
    public SubmitOutcome submit(Long teacherId, UUID id, boolean confirmed, List<RosterEntryDTO> overrides) {
        CaptureSession session = require(teacherId, id);
        session.requireState(SessionState.REVIEW, "submit");
        if (!confirmed) {
            throw new InvalidRequestException("Submission must be confirmed");
        }

        if (overrides != null && !overrides.isEmpty()) {
            session.replaceRoster(applyOverrides(session.getRoster(), overrides));
        }

        List<RosterEntryDTO> roster = session.getRoster();
        int present = (int) roster.stream()
                .filter(e -> e.getStatus() != null && e.getStatus().countsAsAttended())
                .count();

        SessionSubmissionDTO submission = SessionSubmissionDTO.builder()
                .classId(session.getDepartment())
                .sectionId(session.getSection())
                .subjectName(session.getSubject())
                .semester(session.getSemester())
                .sessionDate(session.getDate())
                .sessionTime(LocalDateTime.now(clock).toLocalTime())
                .totalStudents(roster.size())
                .presentCount(present)
                .absentCount(roster.size() - present)
                .recognitionAccuracy(accuracy(session.getRecognizedCount(), roster.size()))
                .records(roster)
                .build();

        SubmissionResult result = submissionService.submit(teacherId, submission);

        session.markSubmitted(result.sessionId());
        sessions.remove(id);

        log.info("Capture {} submitted as session {}", id, result.sessionId());
        return new SubmitOutcome(CaptureSessionView.of(session), result);
    }

    /**
     * Any state -> FILTER.
     */
    public CaptureSessionView cancel(Long teacherId, UUID id) {
        CaptureSession session = require(teacherId, id);
        sessions.remove(id);
        session.cancel();
        log.info("Capture {} cancelled by teacher {}", id, teacherId);
        return CaptureSessionView.of(session);
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private CaptureSession require(Long teacherId, UUID id) {
        CaptureSession session = sessions.get(id);
        if (session == null) {
            throw new ResourceNotFoundException("Capture session", id);
        }
        if (!session.getTeacherId().equals(teacherId)) {
            throw new OperationNotPermittedException("Capture session belongs to another teacher");
        }
        return session;
    }

    private Optional<EnrolledFace> toEnrolledFace(Student student) {
        String json = student.getFaceEmbeddings();
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            List<List<Double>> embeddings = objectMapper.readValue(json, EMBEDDINGS);
            if (embeddings == null || embeddings.isEmpty() || embeddings.get(0) == null) {
                return Optional.empty();
            }
            return Optional.of(new EnrolledFace(student.getId(), student.getUsn(), student.getName(), embeddings.get(0)));
        } catch (Exception e) {
            log.warn("Failed to parse embeddings for {}: {}", student.getUsn(), e.getMessage());
            return Optional.empty();
        }
    }

    private static List<RosterEntryDTO> applyOverrides(List<RosterEntryDTO> draft, List<RosterEntryDTO> overrides) {
        // later overrides for a USN win over earlier ones
        Map<String, RosterEntryDTO> byUsn = new LinkedHashMap<>();
        draft.forEach(e -> byUsn.put(e.getUsn(), e));

        for (RosterEntryDTO override : overrides) {
            byUsn.merge(override.getUsn(), override, (current, o) -> RosterEntryDTO.builder()
                    .usn(current.getUsn())
                    .status(o.getStatus() != null ? o.getStatus() : current.getStatus())
                    .confidence(current.getConfidence())
                    .emotion(current.getEmotion())
                    .attentiveness(current.getAttentiveness())
                    .reasonType(o.getReasonType())
                    .build());
        }
        return new ArrayList<>(byUsn.values());
    }

    private static BigDecimal accuracy(int recognized, int total) {
        if (total == 0) {
            return null;
        }
        return BigDecimal.valueOf(recognized * 100L).divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);
    }

    private void evictStale(LocalDate today) {
        sessions.values().removeIf(s -> s.getDate().isBefore(today));
    }
}

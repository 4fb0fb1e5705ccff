package com.heronix.attendance.controller.api;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.attendance.lifecycle.SessionLifecycleService;
import com.heronix.attendance.lifecycle.SessionLifecycleService.CaptureSessionView;
import com.heronix.attendance.lifecycle.SessionLifecycleService.SubmitOutcome;
import com.heronix.attendance.model.domain.AttendanceSession;
import com.heronix.attendance.model.dto.AttendanceSessionDTO;
import com.heronix.attendance.model.dto.AuthorizationDecision;
import com.heronix.attendance.model.dto.RecordUpdateDTO;
import com.heronix.attendance.model.dto.ResolvedPeriod;
import com.heronix.attendance.model.dto.RosterEntryDTO;
import com.heronix.attendance.model.dto.SessionSubmissionDTO;
import com.heronix.attendance.model.dto.StudentHistoryEntry;
import com.heronix.attendance.model.dto.WindowCheck;
import com.heronix.attendance.service.AttendanceRecordService;
import com.heronix.attendance.service.AttendanceRecordService.SessionRecords;
import com.heronix.attendance.service.AttendanceRecordService.UpdateResult;
import com.heronix.attendance.service.AttendanceSubmissionService;
import com.heronix.attendance.service.AttendanceSubmissionService.SubmissionResult;
import com.heronix.attendance.service.AuthorizationGateService;
import com.heronix.attendance.service.TimeWindowService;
import com.heronix.attendance.service.TimetableService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for taking and correcting attendance.
 *
 * The calling teacher is identified by the X-Teacher-Id header.
 */
@RestController
@RequestMapping("/api/v1/attendance")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Attendance", description = "Authorization, capture sessions, submission and records")
public class AttendanceController {

    private static final String TEACHER_HEADER = "X-Teacher-Id";

    private final AuthorizationGateService authorizationGate;
    private final TimetableService timetableService;
    private final TimeWindowService timeWindowService;
    private final SessionLifecycleService lifecycleService;
    private final AttendanceSubmissionService submissionService;
    private final AttendanceRecordService recordService;
    private final Clock clock;

    // ========================================================================
    // GATE
    // ========================================================================

    @PostMapping("/authorization")
    @Operation(summary = "Check authorization", description = "Check whether the teacher may take attendance for a class and subject")
    @ApiResponse(responseCode = "200", description = "Decision returned")
    public ResponseEntity<AuthorizationDecision> checkAuthorization(
            @RequestHeader(TEACHER_HEADER) Long teacherId,
            @Valid @RequestBody ClassSubjectRequest request) {

        return ResponseEntity.ok(authorizationGate.authorize(teacherId, request.semester(),
                request.department(), request.section(), request.subject(), request.date()));
    }

    @GetMapping("/window")
    @Operation(summary = "Check time window", description = "Check the attendance window of the subject's closest period today")
    public ResponseEntity<WindowStatus> checkWindow(
            @RequestParam Integer semester,
            @RequestParam String department,
            @RequestParam String section,
            @RequestParam String subject) {

        LocalDateTime now = LocalDateTime.now(clock);
        List<ResolvedPeriod> periods = timetableService
                .resolve(now.toLocalDate(), semester, department, section)
                .periodsFor(subject);

        return timeWindowService.selectClosest(now.toLocalTime(), periods)
                .map(p -> ResponseEntity.ok(new WindowStatus(p, timeWindowService.isWithinWindow(now.toLocalTime(), p))))
                .orElseGet(() -> ResponseEntity.ok(new WindowStatus(null,
                        WindowCheck.closed("No period of " + subject + " is scheduled today"))));
    }

    @GetMapping("/sessions/existing")
    @Operation(summary = "Check existing session", description = "Check whether the time slot already has a session")
    public ResponseEntity<ExistingSessionResponse> checkExistingSession(
            @RequestHeader(TEACHER_HEADER) Long teacherId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam Integer semester,
            @RequestParam String department,
            @RequestParam String section,
            @RequestParam String subject) {

        LocalDateTime now = LocalDateTime.now(clock);
        var reference = timeWindowService.selectClosest(now.toLocalTime(),
                        timetableService.resolve(date, semester, department, section).periodsFor(subject))
                .map(ResolvedPeriod::startTime)
                .orElse(now.toLocalTime());

        return ResponseEntity.ok(submissionService
                .findExistingSession(teacherId, semester, department, section, subject, date, reference)
                .map(AttendanceSession::getId)
                .map(id -> new ExistingSessionResponse(true, id))
                .orElse(new ExistingSessionResponse(false, null)));
    }

    // ========================================================================
    // CAPTURE LIFECYCLE
    // ========================================================================

    @PostMapping("/capture")
    @Operation(summary = "Open capture session", description = "Start taking attendance for the current period")
    @ApiResponse(responseCode = "201", description = "Capture session opened")
    @ApiResponse(responseCode = "403", description = "Not authorized or outside the attendance window")
    @ApiResponse(responseCode = "409", description = "Attendance already taken for this slot")
    public ResponseEntity<CaptureSessionView> openCapture(
            @RequestHeader(TEACHER_HEADER) Long teacherId,
            @Valid @RequestBody ClassSubjectRequest request) {

        CaptureSessionView view = lifecycleService.open(teacherId, request.semester(),
                request.department(), request.section(), request.subject());
        return ResponseEntity.status(HttpStatus.CREATED).body(view);
    }

    @GetMapping("/capture/{id}")
    public ResponseEntity<CaptureSessionView> getCapture(
            @RequestHeader(TEACHER_HEADER) Long teacherId,
            @PathVariable UUID id) {
        return ResponseEntity.ok(lifecycleService.get(teacherId, id));
    }

    @PostMapping("/capture/{id}/images")
    @Operation(summary = "Add images", description = "Add captured images (base64) to a capture session")
    public ResponseEntity<CaptureSessionView> addImages(
            @RequestHeader(TEACHER_HEADER) Long teacherId,
            @PathVariable UUID id,
            @RequestBody ImagesRequest request) {
        return ResponseEntity.ok(lifecycleService.addImages(teacherId, id, request.images()));
    }

    @PostMapping("/capture/{id}/recognize")
    @Operation(summary = "Recognize faces", description = "Run face recognition and build the draft roster")
    @ApiResponse(responseCode = "503", description = "Recognition service unavailable")
    public ResponseEntity<CaptureSessionView> recognize(
            @RequestHeader(TEACHER_HEADER) Long teacherId,
            @PathVariable UUID id) {
        return ResponseEntity.ok(lifecycleService.recognize(teacherId, id));
    }

    @PostMapping("/capture/{id}/submit")
    @Operation(summary = "Submit capture", description = "Submit the reviewed roster of a capture session")
    public ResponseEntity<SubmitOutcome> submitCapture(
            @RequestHeader(TEACHER_HEADER) Long teacherId,
            @PathVariable UUID id,
            @RequestBody CaptureSubmitRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(lifecycleService.submit(teacherId, id, request.confirmed(), request.overrides()));
    }

    @DeleteMapping("/capture/{id}")
    @Operation(summary = "Cancel capture", description = "Discard a capture session and return to filter selection")
    public ResponseEntity<CaptureSessionView> cancelCapture(
            @RequestHeader(TEACHER_HEADER) Long teacherId,
            @PathVariable UUID id) {
        return ResponseEntity.ok(lifecycleService.cancel(teacherId, id));
    }

    // ========================================================================
    // SUBMISSION AND RECORDS
    // ========================================================================

    @PostMapping("/submit")
    @Operation(summary = "Submit attendance", description = "Store a session and its roster")
    @ApiResponse(responseCode = "201", description = "Session stored")
    @ApiResponse(responseCode = "409", description = "Session already exists for this time slot")
    @ApiResponse(responseCode = "422", description = "No record could be stored")
    public ResponseEntity<SubmissionResult> submit(
            @RequestHeader(TEACHER_HEADER) Long teacherId,
            @Valid @RequestBody SessionSubmissionDTO submission) {

        log.info("Submission from teacher {} for {} on {}", teacherId, submission.getSubjectName(), submission.getSessionDate());
        return ResponseEntity.status(HttpStatus.CREATED).body(submissionService.submit(teacherId, submission));
    }

    @GetMapping("/sessions")
    @Operation(summary = "List sessions", description = "List the teacher's sessions, newest first")
    public ResponseEntity<List<AttendanceSessionDTO>> listSessions(
            @RequestHeader(TEACHER_HEADER) Long teacherId,
            @RequestParam(required = false) String classId,
            @RequestParam(required = false) String sectionId,
            @RequestParam(required = false) String subject,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(recordService.listSessions(teacherId, classId, sectionId, subject, date));
    }

    @GetMapping("/sessions/{id}")
    public ResponseEntity<SessionRecords> getSession(@PathVariable Long id) {
        return ResponseEntity.ok(recordService.getSession(id));
    }

    @GetMapping("/records")
    @Operation(summary = "Class records", description = "All sessions of a class and subject with their records")
    public ResponseEntity<List<SessionRecords>> classRecords(
            @RequestParam String classId,
            @RequestParam String sectionId,
            @RequestParam Integer semester,
            @RequestParam String subject,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(recordService.sessionsWithRecords(classId, sectionId, semester, subject, date));
    }

    @PutMapping("/sessions/{id}/records")
    @Operation(summary = "Correct records", description = "Correct today's records of one of the teacher's sessions")
    @ApiResponse(responseCode = "403", description = "Not the session's teacher, or not today's records")
    public ResponseEntity<UpdateResult> updateRecords(
            @RequestHeader(TEACHER_HEADER) Long teacherId,
            @PathVariable Long id,
            @Valid @RequestBody List<RecordUpdateDTO> updates) {
        return ResponseEntity.ok(recordService.updateRecords(teacherId, id, updates));
    }

    @GetMapping("/students/{studentId}/history")
    @Operation(summary = "Student history", description = "Attendance history of a student")
    public ResponseEntity<List<StudentHistoryEntry>> studentHistory(
            @PathVariable Long studentId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) Integer semester) {
        return ResponseEntity.ok(recordService.studentHistory(studentId, date, semester));
    }

    // ========================================================================
    // REQUEST/RESPONSE TYPES
    // ========================================================================

    public record ClassSubjectRequest(
            @NotNull Integer semester,
            @NotBlank String department,
            @NotBlank String section,
            @NotBlank String subject,
            LocalDate date
    ) {}

    public record WindowStatus(
            ResolvedPeriod period,
            WindowCheck window
    ) {}

    public record ExistingSessionResponse(
            boolean sessionExists,
            Long sessionId
    ) {}

    public record ImagesRequest(
            List<String> images
    ) {}

    public record CaptureSubmitRequest(
            boolean confirmed,
            List<RosterEntryDTO> overrides
    ) {}
}

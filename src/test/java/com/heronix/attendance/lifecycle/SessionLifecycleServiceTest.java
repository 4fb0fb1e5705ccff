package com.heronix.attendance.lifecycle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.heronix.attendance.adapter.recognition.FaceRecognitionClient;
import com.heronix.attendance.adapter.recognition.FaceRecognitionClient.RecognitionResult;
import com.heronix.attendance.adapter.recognition.FaceRecognitionClient.RecognizedStudent;
import com.heronix.attendance.config.AttendanceProperties;
import com.heronix.attendance.exception.AuthorizationDeniedException;
import com.heronix.attendance.exception.InvalidRequestException;
import com.heronix.attendance.exception.InvalidStateTransitionException;
import com.heronix.attendance.exception.OperationNotPermittedException;
import com.heronix.attendance.exception.RecognitionServiceException;
import com.heronix.attendance.exception.ResourceNotFoundException;
import com.heronix.attendance.exception.SessionAlreadyExistsException;
import com.heronix.attendance.exception.TimeWindowDeniedException;
import com.heronix.attendance.lifecycle.SessionLifecycleService.CaptureSessionView;
import com.heronix.attendance.model.domain.AttendanceSession;
import com.heronix.attendance.model.domain.Student;
import com.heronix.attendance.model.dto.AuthorizationDecision;
import com.heronix.attendance.model.dto.ResolvedPeriod;
import com.heronix.attendance.model.dto.ResolvedSchedule;
import com.heronix.attendance.model.dto.RosterEntryDTO;
import com.heronix.attendance.model.dto.SessionSubmissionDTO;
import com.heronix.attendance.model.enums.AttendanceStatus;
import com.heronix.attendance.model.enums.ScheduleSource;
import com.heronix.attendance.model.enums.SessionState;
import com.heronix.attendance.repository.StudentRepository;
import com.heronix.attendance.service.AttendanceSubmissionService;
import com.heronix.attendance.service.AttendanceSubmissionService.SubmissionResult;
import com.heronix.attendance.service.AuthorizationGateService;
import com.heronix.attendance.service.TimeWindowService;
import com.heronix.attendance.service.TimetableService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class SessionLifecycleServiceTest {

    private static final Long TEACHER_ID = 7L;
    // a Monday
    private static final LocalDate TODAY = LocalDate.of(2024, 10, 7);
    private static final ResolvedPeriod DBMS_PERIOD = new ResolvedPeriod("DBMS", LocalTime.of(9, 0),
            LocalTime.of(10, 0), 1, ScheduleSource.RECURRING);

    @Mock
    private AuthorizationGateService authorizationGate;

    @Mock
    private TimetableService timetableService;

    @Mock
    private AttendanceSubmissionService submissionService;

    @Mock
    private FaceRecognitionClient recognitionClient;

    @Mock
    private StudentRepository studentRepository;

    private SessionLifecycleService lifecycle;

    @BeforeEach
    void setUp() {
        lifecycleAt("2024-10-07T09:05:00Z");
    }

    private void lifecycleAt(String instant) {
        Clock clock = Clock.fixed(Instant.parse(instant), ZoneOffset.UTC);
        lifecycle = new SessionLifecycleService(authorizationGate, timetableService,
                new TimeWindowService(new AttendanceProperties()), submissionService, recognitionClient,
                studentRepository, new ObjectMapper(), clock);
    }

    private void givenAuthorizedWithPeriod() {
        given(authorizationGate.authorize(TEACHER_ID, 3, "CS", "A", "DBMS", TODAY))
                .willReturn(AuthorizationDecision.granted());
        given(timetableService.resolve(TODAY, 3, "CS", "A"))
                .willReturn(new ResolvedSchedule(TODAY, DayOfWeek.MONDAY, List.of(DBMS_PERIOD), false));
    }

    private CaptureSessionView openCapture() {
        givenAuthorizedWithPeriod();
        given(submissionService.findExistingSession(TEACHER_ID, 3, "CS", "A", "DBMS", TODAY, LocalTime.of(9, 0)))
                .willReturn(Optional.empty());
        return lifecycle.open(TEACHER_ID, 3, "CS", "A", "DBMS");
    }

    private static Student student(long id, String usn, String embeddings) {
        return Student.builder().id(id).usn(usn).name(usn).department("CS").faceEmbeddings(embeddings).build();
    }

    private CaptureSessionView reviewWithAshaRecognized() {
        CaptureSessionView view = openCapture();
        lifecycle.addImages(TEACHER_ID, view.id(), List.of("aW1hZ2U="));
        given(studentRepository.findEnrolled(3, "CS", "A", "DBMS", TODAY)).willReturn(List.of(
                student(1L, "1CS21001", "[[0.1,0.2]]"),
                student(2L, "1CS21002", "[[0.3,0.4]]")));
        given(recognitionClient.recognize(anyList(), anyList())).willReturn(new RecognitionResult(
                List.of(new RecognizedStudent("1CS21001", "Asha", new BigDecimal("0.9132"), "happy", "attentive")),
                2, List.of(), "ok"));
        return lifecycle.recognize(TEACHER_ID, view.id());
    }

    @Test
    void opensCaptureInsideTheWindow() {
        CaptureSessionView view = openCapture();

        assertThat(view.state()).isEqualTo(SessionState.CAPTURE);
        assertThat(view.period()).isEqualTo(DBMS_PERIOD);
        assertThat(lifecycle.get(TEACHER_ID, view.id()).id()).isEqualTo(view.id());
    }

    @Test
    void deniedTeacherNeverReachesTheTimetable() {
        given(authorizationGate.authorize(TEACHER_ID, 3, "CS", "A", "DBMS", TODAY))
                .willReturn(AuthorizationDecision.ended("DBMS", LocalDate.of(2024, 6, 30)));

        assertThatThrownBy(() -> lifecycle.open(TEACHER_ID, 3, "CS", "A", "DBMS"))
                .isInstanceOf(AuthorizationDeniedException.class);
        verifyNoInteractions(timetableService);
    }

    @Test
    void outsideTheWindowIsDenied() {
        lifecycleAt("2024-10-07T08:30:00Z");
        givenAuthorizedWithPeriod();

        assertThatThrownBy(() -> lifecycle.open(TEACHER_ID, 3, "CS", "A", "DBMS"))
                .isInstanceOf(TimeWindowDeniedException.class)
                .satisfies(e -> assertThat(((TimeWindowDeniedException) e).getCheck().minutesUntilOpen())
                        .isEqualTo(15L));
    }

    @Test
    void dayWithoutThePeriodCannotBeOpened() {
        given(authorizationGate.authorize(TEACHER_ID, 3, "CS", "A", "DBMS", TODAY))
                .willReturn(AuthorizationDecision.granted());
        given(timetableService.resolve(TODAY, 3, "CS", "A"))
                .willReturn(new ResolvedSchedule(TODAY, DayOfWeek.MONDAY, List.of(), true));

        assertThatThrownBy(() -> lifecycle.open(TEACHER_ID, 3, "CS", "A", "DBMS"))
                .isInstanceOf(OperationNotPermittedException.class);
    }

    @Test
    void takenSlotCannotBeOpenedAgain() {
        givenAuthorizedWithPeriod();
        given(submissionService.findExistingSession(TEACHER_ID, 3, "CS", "A", "DBMS", TODAY, LocalTime.of(9, 0)))
                .willReturn(Optional.of(AttendanceSession.builder().id(11L).build()));

        assertThatThrownBy(() -> lifecycle.open(TEACHER_ID, 3, "CS", "A", "DBMS"))
                .isInstanceOf(SessionAlreadyExistsException.class);
    }

    @Test
    void recognitionBuildsTheDraftRoster() {
        CaptureSessionView view = reviewWithAshaRecognized();

        assertThat(view.state()).isEqualTo(SessionState.REVIEW);
        assertThat(view.recognizedCount()).isEqualTo(1);
        assertThat(view.totalFacesDetected()).isEqualTo(2);
        assertThat(view.roster()).extracting(RosterEntryDTO::getStatus)
                .containsExactly(AttendanceStatus.PRESENT, AttendanceStatus.ABSENT);
        assertThat(view.roster().get(0).getConfidence()).isEqualByComparingTo("0.9132");
    }

    @Test
    void recognitionNeedsImages() {
        CaptureSessionView view = openCapture();

        assertThatThrownBy(() -> lifecycle.recognize(TEACHER_ID, view.id()))
                .isInstanceOf(InvalidRequestException.class);
        verifyNoInteractions(recognitionClient);
    }

    @Test
    void studentsWithoutEmbeddingsCannotBeRecognized() {
        CaptureSessionView view = openCapture();
        lifecycle.addImages(TEACHER_ID, view.id(), List.of("aW1hZ2U="));
        given(studentRepository.findEnrolled(3, "CS", "A", "DBMS", TODAY))
                .willReturn(List.of(student(1L, "1CS21001", null), student(2L, "1CS21002", "not json")));

        assertThatThrownBy(() -> lifecycle.recognize(TEACHER_ID, view.id()))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("No students have registered face embeddings");
    }

    @Test
    void failedRecognitionStaysInCapture() {
        CaptureSessionView view = openCapture();
        lifecycle.addImages(TEACHER_ID, view.id(), List.of("aW1hZ2U="));
        given(studentRepository.findEnrolled(3, "CS", "A", "DBMS", TODAY))
                .willReturn(List.of(student(1L, "1CS21001", "[[0.1]]")));
        given(recognitionClient.recognize(anyList(), anyList()))
                .willThrow(new RecognitionServiceException("Face recognition service is unavailable"));

        assertThatThrownBy(() -> lifecycle.recognize(TEACHER_ID, view.id()))
                .isInstanceOf(RecognitionServiceException.class);
        assertThat(lifecycle.get(TEACHER_ID, view.id()).state()).isEqualTo(SessionState.CAPTURE);
    }

    @Test
    void submitAppliesOverridesAndHandsOff() {
        CaptureSessionView view = reviewWithAshaRecognized();
        given(submissionService.submit(eq(TEACHER_ID), any(SessionSubmissionDTO.class)))
                .willReturn(SubmissionResult.of(55L, 2, 0));

        SessionLifecycleService.SubmitOutcome outcome = lifecycle.submit(TEACHER_ID, view.id(), true, List.of(
                RosterEntryDTO.builder().usn("1CS21002").status(AttendanceStatus.EXCUSED).reasonType("medical").build()));

        ArgumentCaptor<SessionSubmissionDTO> submitted = ArgumentCaptor.forClass(SessionSubmissionDTO.class);
        verify(submissionService).submit(eq(TEACHER_ID), submitted.capture());
        assertThat(submitted.getValue().getPresentCount()).isEqualTo(2);
        assertThat(submitted.getValue().getAbsentCount()).isZero();
        assertThat(submitted.getValue().getRecognitionAccuracy()).isEqualByComparingTo("50.00");
        assertThat(submitted.getValue().getRecords().get(1).getReasonType()).isEqualTo("medical");

        assertThat(outcome.session().state()).isEqualTo(SessionState.SUBMITTED);
        assertThat(outcome.session().submittedSessionId()).isEqualTo(55L);
    }

    @Test
    void repeatedOverridesForOneStudentKeepTheLastStatus() {
        CaptureSessionView view = reviewWithAshaRecognized();
        given(submissionService.submit(eq(TEACHER_ID), any(SessionSubmissionDTO.class)))
                .willReturn(SubmissionResult.of(56L, 2, 0));

        lifecycle.submit(TEACHER_ID, view.id(), true, List.of(
                RosterEntryDTO.builder().usn("1CS21002").status(AttendanceStatus.PRESENT).build(),
                RosterEntryDTO.builder().usn("1CS21002").status(AttendanceStatus.LATE).build(),
                RosterEntryDTO.builder().usn("1CS21003").status(AttendanceStatus.PRESENT).build(),
                RosterEntryDTO.builder().usn("1CS21003").status(AttendanceStatus.ABSENT).build()));

        ArgumentCaptor<SessionSubmissionDTO> submitted = ArgumentCaptor.forClass(SessionSubmissionDTO.class);
        verify(submissionService).submit(eq(TEACHER_ID), submitted.capture());
        assertThat(submitted.getValue().getRecords())
                .extracting(RosterEntryDTO::getUsn, RosterEntryDTO::getStatus)
                .containsExactly(
                        tuple("1CS21001", AttendanceStatus.PRESENT),
                        tuple("1CS21002", AttendanceStatus.LATE),
                        tuple("1CS21003", AttendanceStatus.ABSENT));
        assertThat(submitted.getValue().getPresentCount()).isEqualTo(2);
        assertThat(submitted.getValue().getAbsentCount()).isEqualTo(1);
    }

    @Test
    void submitRequiresConfirmation() {
        CaptureSessionView view = reviewWithAshaRecognized();

        assertThatThrownBy(() -> lifecycle.submit(TEACHER_ID, view.id(), false, null))
                .isInstanceOf(InvalidRequestException.class);
        verify(submissionService, never()).submit(any(), any());
    }

    @Test
    void submitBeforeReviewIsAnInvalidTransition() {
        CaptureSessionView view = openCapture();

        assertThatThrownBy(() -> lifecycle.submit(TEACHER_ID, view.id(), true, null))
                .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    void cancelReturnsToFilterAndForgetsTheCapture() {
        CaptureSessionView view = openCapture();

        CaptureSessionView cancelled = lifecycle.cancel(TEACHER_ID, view.id());

        assertThat(cancelled.state()).isEqualTo(SessionState.FILTER);
        assertThatThrownBy(() -> lifecycle.get(TEACHER_ID, view.id()))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void anotherTeacherCannotTouchTheCapture() {
        CaptureSessionView view = openCapture();

        assertThatThrownBy(() -> lifecycle.addImages(99L, view.id(), List.of("aW1hZ2U=")))
                .isInstanceOf(OperationNotPermittedException.class);
    }
}

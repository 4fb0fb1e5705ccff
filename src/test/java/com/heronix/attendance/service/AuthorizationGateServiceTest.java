package com.heronix.attendance.service;

import com.heronix.attendance.exception.InvalidRequestException;
import com.heronix.attendance.model.domain.EnrollmentInterval;
import com.heronix.attendance.model.dto.AuthorizationDecision;
import com.heronix.attendance.model.enums.DenialReason;
import com.heronix.attendance.model.enums.OwnerType;
import com.heronix.attendance.repository.EnrollmentIntervalRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class AuthorizationGateServiceTest {

    private static final Long TEACHER_ID = 7L;

    @Mock
    private EnrollmentIntervalRepository intervalRepository;

    private AuthorizationGateService gate;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-10-01T08:00:00Z"), ZoneOffset.UTC);
        gate = new AuthorizationGateService(intervalRepository, clock);
    }

    private void givenIntervals(EnrollmentInterval... intervals) {
        given(intervalRepository.findByOwnerTypeAndOwnerIdAndSemesterAndDepartmentAndSectionAndSubject(
                any(OwnerType.class), anyLong(), anyInt(), anyString(), anyString(), anyString()))
                .willReturn(List.of(intervals));
    }

    private static EnrollmentInterval interval(LocalDate from, LocalDate to) {
        return EnrollmentInterval.builder()
                .ownerType(OwnerType.TEACHER)
                .ownerId(TEACHER_ID)
                .semester(3)
                .department("CS")
                .section("A")
                .subject("DBMS")
                .enrollmentDate(from)
                .completionDate(to)
                .build();
    }

    @Test
    void grantsWhenAnIntervalCoversTheDate() {
        givenIntervals(interval(LocalDate.of(2024, 8, 1), LocalDate.of(2024, 12, 31)));

        AuthorizationDecision decision = gate.authorize(TEACHER_ID, 3, "CS", "A", "DBMS",
                LocalDate.of(2024, 10, 1));

        assertThat(decision.authorized()).isTrue();
        assertThat(decision.reason()).isNull();
    }

    @Test
    void deniesNotYetActiveBeforeTheStart() {
        givenIntervals(interval(LocalDate.of(2024, 8, 1), LocalDate.of(2024, 12, 31)));

        AuthorizationDecision decision = gate.authorize(TEACHER_ID, 3, "CS", "A", "DBMS",
                LocalDate.of(2024, 7, 15));

        assertThat(decision.authorized()).isFalse();
        assertThat(decision.reason()).isEqualTo(DenialReason.NOT_YET_ACTIVE);
        assertThat(decision.activatesOn()).isEqualTo(LocalDate.of(2024, 8, 1));
        assertThat(decision.message()).contains("2024-08-01");
    }

    @Test
    void deniesEndedAfterTheCompletion() {
        givenIntervals(interval(LocalDate.of(2024, 8, 1), LocalDate.of(2024, 12, 31)));

        AuthorizationDecision decision = gate.authorize(TEACHER_ID, 3, "CS", "A", "DBMS",
                LocalDate.of(2025, 1, 5));

        assertThat(decision.reason()).isEqualTo(DenialReason.ENDED);
        assertThat(decision.endedOn()).isEqualTo(LocalDate.of(2024, 12, 31));
        assertThat(decision.message()).contains("ended on 2024-12-31");
    }

    @Test
    void deniesNotAssignedWithoutIntervals() {
        given(intervalRepository.findByOwnerTypeAndOwnerIdAndSemesterAndDepartmentAndSectionAndSubject(
                OwnerType.TEACHER, TEACHER_ID, 3, "CS", "A", "DBMS"))
                .willReturn(Collections.emptyList());

        AuthorizationDecision decision = gate.authorize(TEACHER_ID, 3, "CS", "A", "DBMS");

        assertThat(decision.reason()).isEqualTo(DenialReason.NOT_ASSIGNED);
        assertThat(decision.message()).isEqualTo("You are not assigned to teach DBMS for CS-A, Semester 3");
    }

    @Test
    void anyActiveIntervalWinsOverEndedOnes() {
        givenIntervals(
                interval(LocalDate.of(2023, 1, 1), LocalDate.of(2023, 6, 30)),
                interval(LocalDate.of(2024, 9, 1), null));

        AuthorizationDecision decision = gate.authorize(TEACHER_ID, 3, "CS", "A", "DBMS");

        assertThat(decision.authorized()).isTrue();
    }

    @Test
    void nearestFutureStartIsReported() {
        givenIntervals(
                interval(LocalDate.of(2023, 1, 1), LocalDate.of(2023, 6, 30)),
                interval(LocalDate.of(2025, 3, 1), null),
                interval(LocalDate.of(2024, 11, 1), LocalDate.of(2024, 12, 31)));

        AuthorizationDecision decision = gate.authorize(TEACHER_ID, 3, "CS", "A", "DBMS");

        assertThat(decision.reason()).isEqualTo(DenialReason.NOT_YET_ACTIVE);
        assertThat(decision.activatesOn()).isEqualTo(LocalDate.of(2024, 11, 1));
    }

    @Test
    void boundaryDaysAreInclusive() {
        givenIntervals(interval(LocalDate.of(2024, 8, 1), LocalDate.of(2024, 12, 31)));

        assertThat(gate.authorize(TEACHER_ID, 3, "CS", "A", "DBMS", LocalDate.of(2024, 8, 1)).authorized()).isTrue();
        assertThat(gate.authorize(TEACHER_ID, 3, "CS", "A", "DBMS", LocalDate.of(2024, 12, 31)).authorized()).isTrue();
    }

    @Test
    void rejectsBlankInput() {
        assertThatThrownBy(() -> gate.authorize(TEACHER_ID, 3, "CS", " ", "DBMS"))
                .isInstanceOf(InvalidRequestException.class);
        verifyNoInteractions(intervalRepository);
    }
}

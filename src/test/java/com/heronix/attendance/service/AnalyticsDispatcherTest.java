package com.heronix.attendance.service;

import com.heronix.attendance.config.AttendanceProperties;
import com.heronix.attendance.service.event.AttendanceSubmittedEvent;
import com.heronix.attendance.exception.AnalyticsInfrastructureException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class AnalyticsDispatcherTest {

    private static final AttendanceSubmittedEvent EVENT = new AttendanceSubmittedEvent(42L, 7L, 3, "DBMS");

    @Mock
    private AnalyticsPipelineService pipelineService;

    @Test
    void runsThePipelineForTheSubmittedSession() {
        new AnalyticsDispatcher(pipelineService, new AttendanceProperties()).onAttendanceSubmitted(EVENT);

        verify(pipelineService).runPipeline(42L, 3, "DBMS");
    }

    @Test
    void doesNothingWhenDisabled() {
        AttendanceProperties properties = new AttendanceProperties();
        properties.getAnalytics().setEnabled(false);

        new AnalyticsDispatcher(pipelineService, properties).onAttendanceSubmitted(EVENT);

        verifyNoInteractions(pipelineService);
    }

    @Test
    void infrastructureFailureDoesNotEscape() {
        given(pipelineService.runPipeline(42L, 3, "DBMS"))
                .willThrow(new AnalyticsInfrastructureException("Session not found: 42"));

        assertThatCode(() -> new AnalyticsDispatcher(pipelineService, new AttendanceProperties())
                .onAttendanceSubmitted(EVENT)).doesNotThrowAnyException();
    }
}

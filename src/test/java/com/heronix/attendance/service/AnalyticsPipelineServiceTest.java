package com.heronix.attendance.service;

import com.heronix.attendance.adapter.inference.InferenceStageClient;
import com.heronix.attendance.config.AttendanceProperties;
import com.heronix.attendance.exception.AnalyticsInfrastructureException;
import com.heronix.attendance.exception.ResourceNotFoundException;
import com.heronix.attendance.exception.StageInvocationException;
import com.heronix.attendance.model.domain.AttendanceSession;
import com.heronix.attendance.model.dto.AttendanceSeriesPoint;
import com.heronix.attendance.model.enums.AttendanceStatus;
import com.heronix.attendance.model.enums.StageTransport;
import com.heronix.attendance.model.enums.StageType;
import com.heronix.attendance.repository.AttendanceRecordRepository;
import com.heronix.attendance.repository.AttendanceSessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AnalyticsPipelineServiceTest {

    private static final Long SESSION_ID = 42L;
    private static final Executor DIRECT = Runnable::run;

    @Mock
    private AttendanceSessionRepository sessionRepository;

    @Mock
    private AttendanceRecordRepository recordRepository;

    @Mock
    private StandingService standingService;

    private RecordingStageClient client;
    private AnalyticsPipelineService pipeline;

    private final List<AttendanceSeriesPoint> seriesOfOne = series(AttendanceStatus.PRESENT, AttendanceStatus.ABSENT);
    private final List<AttendanceSeriesPoint> seriesOfTwo = series(AttendanceStatus.PRESENT, AttendanceStatus.PRESENT);

    @BeforeEach
    void setUp() {
        client = new RecordingStageClient((stage, payload) -> "ok-" + stage.getOutputField());
        pipeline = newPipeline(client);
    }

    private AnalyticsPipelineService newPipeline(InferenceStageClient stageClient) {
        Map<StageTransport, InferenceStageClient> clients = new EnumMap<>(StageTransport.class);
        clients.put(StageTransport.HTTP, stageClient);
        return new AnalyticsPipelineService(sessionRepository, recordRepository, standingService, clients,
                new AttendanceProperties(), DIRECT, DIRECT);
    }

    private static List<AttendanceSeriesPoint> series(AttendanceStatus... statuses) {
        List<AttendanceSeriesPoint> points = new ArrayList<>();
        for (int i = 0; i < statuses.length; i++) {
            LocalDate day = LocalDate.of(2024, 9, 2).plusDays(i);
            points.add(new AttendanceSeriesPoint(statuses[i], new BigDecimal("0.9100"), "neutral", "attentive",
                    day.atTime(9, 5), day));
        }
        return points;
    }

    private void givenSessionWithStudents(Long... studentIds) {
        given(sessionRepository.existsById(SESSION_ID)).willReturn(true);
        given(recordRepository.findDistinctStudentIdsBySessionId(SESSION_ID)).willReturn(List.of(studentIds));
    }

    @Test
    void storesAStandingPerStudent() {
        givenSessionWithStudents(1L, 2L);
        given(recordRepository.findSeries(1L, "DBMS", 3)).willReturn(seriesOfOne);
        given(recordRepository.findSeries(2L, "DBMS", 3)).willReturn(seriesOfTwo);

        AnalyticsPipelineService.PipelineResult result = pipeline.runPipeline(SESSION_ID, 3, "DBMS");

        assertThat(result.successCount()).isEqualTo(2);
        assertThat(result.failureCount()).isZero();
        assertThat(result.total()).isEqualTo(2);

        ArgumentCaptor<StandingService.StageOutputs> outputs = ArgumentCaptor.forClass(StandingService.StageOutputs.class);
        verify(standingService).upsert(eq(1L), eq("DBMS"), eq(3), outputs.capture(), eq(SESSION_ID));
        assertThat(outputs.getValue()).isEqualTo(new StandingService.StageOutputs(
                "ok-trend", "ok-consistency", "ok-attentiveness", "ok-risk"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void feedsEachStageItsUpstreamOutputs() {
        givenSessionWithStudents(1L);
        given(recordRepository.findSeries(1L, "DBMS", 3)).willReturn(seriesOfOne);

        pipeline.runPipeline(SESSION_ID, 3, "DBMS");

        assertThat(client.payloads.get(StageType.TREND)).isSameAs(seriesOfOne);
        assertThat(client.payloads.get(StageType.CONSISTENCY)).isSameAs(seriesOfOne);

        Map<String, Object> attentivenessInput = (Map<String, Object>) client.payloads.get(StageType.ATTENTIVENESS);
        assertThat(attentivenessInput)
                .containsEntry("attendance_data", seriesOfOne)
                .containsEntry("consistency_from_model3", "ok-consistency");

        Map<String, Object> riskInput = (Map<String, Object>) client.payloads.get(StageType.RISK);
        assertThat(riskInput)
                .containsEntry("student_data", seriesOfOne)
                .containsEntry("model1_result", Map.of("trend", "ok-trend"))
                .containsEntry("model3_result", Map.of("consistency", "ok-consistency"))
                .containsEntry("model4_result", Map.of("attentiveness", "ok-attentiveness"))
                .containsEntry("class_data", null)
                .containsEntry("total_sessions_planned", 50);

        assertThat(client.order.indexOf(StageType.ATTENTIVENESS))
                .isGreaterThan(client.order.indexOf(StageType.CONSISTENCY));
        assertThat(client.order.get(client.order.size() - 1)).isEqualTo(StageType.RISK);
    }

    @Test
    void failingStageOnlyFailsItsStudent() {
        client = new RecordingStageClient((stage, payload) -> {
            if (stage == StageType.ATTENTIVENESS && ((Map<?, ?>) payload).get("attendance_data") == seriesOfTwo) {
                throw new StageInvocationException(stage, "worker exited with code 1");
            }
            return "ok-" + stage.getOutputField();
        });
        pipeline = newPipeline(client);
        givenSessionWithStudents(1L, 2L);
        given(recordRepository.findSeries(1L, "DBMS", 3)).willReturn(seriesOfOne);
        given(recordRepository.findSeries(2L, "DBMS", 3)).willReturn(seriesOfTwo);

        AnalyticsPipelineService.PipelineResult result = pipeline.runPipeline(SESSION_ID, 3, "DBMS");

        assertThat(result.successCount()).isEqualTo(1);
        assertThat(result.failureCount()).isEqualTo(1);
        verify(standingService).upsert(eq(1L), eq("DBMS"), eq(3), any(), eq(SESSION_ID));
        verify(standingService, never()).upsert(eq(2L), any(), any(), any(), any());
    }

    @Test
    void blankOrOversizedOutputFailsTheStudent() {
        client = new RecordingStageClient((stage, payload) ->
                stage == StageType.TREND ? "   " : "x".repeat(stage == StageType.RISK ? 51 : 3));
        pipeline = newPipeline(client);
        givenSessionWithStudents(1L);
        given(recordRepository.findSeries(1L, "DBMS", 3)).willReturn(seriesOfOne);

        AnalyticsPipelineService.PipelineResult result = pipeline.runPipeline(SESSION_ID, 3, "DBMS");

        assertThat(result.failureCount()).isEqualTo(1);
        verify(standingService, never()).upsert(anyLong(), any(), any(), any(), any());
    }

    @Test
    void studentWithoutHistoryIsSkipped() {
        givenSessionWithStudents(1L);
        given(recordRepository.findSeries(1L, "DBMS", 3)).willReturn(Collections.emptyList());

        AnalyticsPipelineService.PipelineResult result = pipeline.runPipeline(SESSION_ID, 3, "DBMS");

        assertThat(result.skippedCount()).isEqualTo(1);
        assertThat(client.order).isEmpty();
    }

    @Test
    void unknownSessionIsAnInfrastructureFailure() {
        given(sessionRepository.existsById(SESSION_ID)).willReturn(false);

        assertThatThrownBy(() -> pipeline.runPipeline(SESSION_ID, 3, "DBMS"))
                .isInstanceOf(AnalyticsInfrastructureException.class);
    }

    @Test
    void unreadableStoreIsAnInfrastructureFailure() {
        given(sessionRepository.existsById(SESSION_ID)).willReturn(true);
        given(recordRepository.findDistinctStudentIdsBySessionId(SESSION_ID))
                .willThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> pipeline.runPipeline(SESSION_ID, 3, "DBMS"))
                .isInstanceOf(AnalyticsInfrastructureException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void missingTransportClientIsAnInfrastructureFailure() {
        AnalyticsPipelineService unwired = new AnalyticsPipelineService(sessionRepository, recordRepository,
                standingService, new EnumMap<>(StageTransport.class), new AttendanceProperties(), DIRECT, DIRECT);

        assertThatThrownBy(() -> unwired.runPipeline(SESSION_ID, 3, "DBMS"))
                .isInstanceOf(AnalyticsInfrastructureException.class)
                .hasMessageContaining("HTTP");
    }

    @Test
    void rerunUsesTheStoredSessionAndCanBeRepeated() {
        AttendanceSession session = AttendanceSession.builder()
                .id(SESSION_ID).semester(3).subjectName("DBMS")
                .sessionDate(LocalDate.of(2024, 9, 3))
                .build();
        given(sessionRepository.findById(SESSION_ID)).willReturn(Optional.of(session));
        givenSessionWithStudents(1L);
        given(recordRepository.findSeries(1L, "DBMS", 3)).willReturn(seriesOfOne);

        pipeline.rerun(SESSION_ID);
        AnalyticsPipelineService.PipelineResult second = pipeline.rerun(SESSION_ID);

        assertThat(second.successCount()).isEqualTo(1);
        verify(standingService, times(2)).upsert(eq(1L), eq("DBMS"), eq(3), any(), eq(SESSION_ID));
    }

    @Test
    void rerunOfUnknownSessionIsNotFound() {
        given(sessionRepository.findById(SESSION_ID)).willReturn(Optional.empty());

        assertThatThrownBy(() -> pipeline.rerun(SESSION_ID)).isInstanceOf(ResourceNotFoundException.class);
    }

    private static class RecordingStageClient implements InferenceStageClient {

        private final BiFunction<StageType, Object, String> behaviour;
        private final Map<StageType, Object> payloads = Collections.synchronizedMap(new EnumMap<>(StageType.class));
        private final List<StageType> order = Collections.synchronizedList(new ArrayList<>());

        RecordingStageClient(BiFunction<StageType, Object, String> behaviour) {
            this.behaviour = behaviour;
        }

        @Override
        public StageTransport getTransport() {
            return StageTransport.HTTP;
        }

        @Override
        public String invoke(StageType stage, Object payload) {
            payloads.put(stage, payload);
            order.add(stage);
            return behaviour.apply(stage, payload);
        }
    }
}

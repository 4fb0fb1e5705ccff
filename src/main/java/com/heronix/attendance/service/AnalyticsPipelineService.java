package com.heronix.attendance.service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import com.heronix.attendance.adapter.inference.InferenceStageClient;
import com.heronix.attendance.config.AttendanceProperties;
import com.heronix.attendance.exception.AnalyticsInfrastructureException;
import com.heronix.attendance.exception.ResourceNotFoundException;
import com.heronix.attendance.exception.StageInvocationException;
import com.heronix.attendance.model.domain.AttendanceSession;
import com.heronix.attendance.model.dto.AttendanceSeriesPoint;
import com.heronix.attendance.model.enums.StageTransport;
import com.heronix.attendance.model.enums.StageType;
import com.heronix.attendance.repository.AttendanceRecordRepository;
import com.heronix.attendance.repository.AttendanceSessionRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs the four inference stages for every student of a submitted session
 * and caches the results as standings.
 *
 * Per student the stages form a small DAG:
 * trend and consistency run in parallel, attentiveness waits for
 * consistency, risk waits for all three. Students are processed
 * independently; a failing stage fails only its own student and leaves that
 * student's previous standing untouched.
 *
 * @author Heronix Development Team
 */
@Service
@Slf4j
public class AnalyticsPipelineService {

    private static final int MAX_OUTPUT_LENGTH = 50;

    private final AttendanceSessionRepository sessionRepository;
    private final AttendanceRecordRepository recordRepository;
    private final StandingService standingService;
    private final Map<StageTransport, InferenceStageClient> stageClients;
    private final AttendanceProperties properties;
    private final Executor studentExecutor;
    private final Executor stageExecutor;

    public AnalyticsPipelineService(AttendanceSessionRepository sessionRepository,
                                    AttendanceRecordRepository recordRepository,
                                    StandingService standingService,
                                    Map<StageTransport, InferenceStageClient> stageClients,
                                    AttendanceProperties properties,
                                    @Qualifier("studentExecutor") Executor studentExecutor,
                                    @Qualifier("stageExecutor") Executor stageExecutor) {
        this.sessionRepository = sessionRepository;
        this.recordRepository = recordRepository;
        this.standingService = standingService;
        this.stageClients = stageClients;
        this.properties = properties;
        this.studentExecutor = studentExecutor;
        this.stageExecutor = stageExecutor;
    }

    /**
     * Outcome of one student's run.
     */
    public enum StudentOutcome {
        SUCCESS,
        SKIPPED,
        FAILED
    }

    /**
     * Pipeline run summary.
     */
    public record PipelineResult(
            Long sessionId,
            int successCount,
            int failureCount,
            int skippedCount
    ) {
        public int total() {
            return successCount + failureCount + skippedCount;
        }
    }

    /**
     * Run the pipeline for every distinct student of a session.
     *
     * Blocks until every student is done.
     *
     * @throws AnalyticsInfrastructureException if the session is unknown or its students cannot be enumerated
     */
    public PipelineResult runPipeline(Long sessionId, Integer semester, String subject) {
        InferenceStageClient client = stageClients.get(properties.getAnalytics().getTransport());
        if (client == null) {
            throw new AnalyticsInfrastructureException(
                    "No inference stage client for transport " + properties.getAnalytics().getTransport());
        }

        List<Long> studentIds;
        try {
            if (!sessionRepository.existsById(sessionId)) {
                throw new AnalyticsInfrastructureException("Session not found: " + sessionId);
            }
            studentIds = recordRepository.findDistinctStudentIdsBySessionId(sessionId);
        } catch (DataAccessException e) {
            throw new AnalyticsInfrastructureException("Cannot enumerate students of session " + sessionId, e);
        }

        log.info("Analytics run for session {} ({} sem {}): {} student(s)", sessionId, subject, semester, studentIds.size());

        List<CompletableFuture<StudentOutcome>> runs = studentIds.stream()
                .map(studentId -> CompletableFuture
                        .supplyAsync(() -> analyzeStudent(client, studentId, sessionId, semester, subject), studentExecutor)
                        .exceptionally(ex -> {
                            log.warn("Analytics failed for student {} in session {}: {}",
                                    studentId, sessionId, rootCause(ex).getMessage());
                            return StudentOutcome.FAILED;
                        }))
                .toList();

        CompletableFuture.allOf(runs.toArray(new CompletableFuture[0])).join();

        int success = 0;
        int failed = 0;
        int skipped = 0;
        for (CompletableFuture<StudentOutcome> run : runs) {
            switch (run.join()) {
                case SUCCESS -> success++;
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
            }
        }

        log.info("Analytics run for session {} finished: {} succeeded, {} failed, {} skipped",
                sessionId, success, failed, skipped);
        return new PipelineResult(sessionId, success, failed, skipped);
    }

    /**
     * Re-run the pipeline for a stored session. Safe to repeat: standings are overwritten.
     */
    public PipelineResult rerun(Long sessionId) {
        AttendanceSession session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Session", sessionId));
        log.info("Manual analytics re-run requested for session {}", sessionId);
        return runPipeline(sessionId, session.getSemester(), session.getSubjectName());
    }

    /**
     * Run the stage DAG for one student and store the standing on success.
     */
    StudentOutcome analyzeStudent(InferenceStageClient client, Long studentId, Long sessionId,
                                  Integer semester, String subject) {
        List<AttendanceSeriesPoint> series = recordRepository.findSeries(studentId, subject, semester);
        if (series.isEmpty()) {
            log.debug("No attendance series for student {} in {} (sem {}), skipping", studentId, subject, semester);
            return StudentOutcome.SKIPPED;
        }

        CompletableFuture<String> trend = stage(client, StageType.TREND, series);
        CompletableFuture<String> consistency = stage(client, StageType.CONSISTENCY, series);

        CompletableFuture<String> attentiveness = consistency.thenCompose(c -> {
            Map<String, Object> input = new HashMap<>();
            input.put("attendance_data", series);
            input.put("consistency_from_model3", c);
            return stage(client, StageType.ATTENTIVENESS, input);
        });

        CompletableFuture<String> risk = CompletableFuture.allOf(trend, consistency, attentiveness)
                .thenCompose(ignored -> {
                    Map<String, Object> input = new HashMap<>();
                    input.put("student_data", series);
                    input.put("model1_result", Map.of(StageType.TREND.getOutputField(), trend.join()));
                    input.put("model3_result", Map.of(StageType.CONSISTENCY.getOutputField(), consistency.join()));
                    input.put("model4_result", Map.of(StageType.ATTENTIVENESS.getOutputField(), attentiveness.join()));
                    input.put("class_data", null);
                    input.put("total_sessions_planned", properties.getAnalytics().getTotalSessionsPlanned());
                    return stage(client, StageType.RISK, input);
                });

        StandingService.StageOutputs outputs = new StandingService.StageOutputs(
                trend.join(), consistency.join(), attentiveness.join(), risk.join());

        standingService.upsert(studentId, subject, semester, outputs, sessionId);
        log.debug("Student {} standing for {}: {}", studentId, subject, outputs);
        return StudentOutcome.SUCCESS;
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private CompletableFuture<String> stage(InferenceStageClient client, StageType stage, Object payload) {
        int timeoutSeconds = properties.getAnalytics().getStageTimeoutSeconds();

        return CompletableFuture
                .supplyAsync(() -> validateOutput(stage, client.invoke(stage, payload)), stageExecutor)
                .orTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .exceptionally(ex -> {
                    Throwable cause = rootCause(ex);
                    if (cause instanceof StageInvocationException) {
                        throw (StageInvocationException) cause;
                    }
                    if (cause instanceof TimeoutException) {
                        throw new StageInvocationException(stage, "timed out after " + timeoutSeconds + "s", cause);
                    }
                    throw new StageInvocationException(stage, String.valueOf(cause.getMessage()), cause);
                });
    }

    private static String validateOutput(StageType stage, String value) {
        if (value == null || value.isBlank()) {
            throw new StageInvocationException(stage, "empty output");
        }
        String trimmed = value.trim();
        if (trimmed.length() > MAX_OUTPUT_LENGTH) {
            throw new StageInvocationException(stage, "output longer than " + MAX_OUTPUT_LENGTH + " characters");
        }
        return trimmed;
    }

    private static Throwable rootCause(Throwable ex) {
        Throwable cause = ex;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}

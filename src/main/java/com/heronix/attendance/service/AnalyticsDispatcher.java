package com.heronix.attendance.service;

import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import com.heronix.attendance.config.AttendanceProperties;
import com.heronix.attendance.exception.AnalyticsInfrastructureException;
import com.heronix.attendance.service.event.AttendanceSubmittedEvent;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Hands committed submissions to the analytics pipeline on its own executor.
 *
 * Rolled back submissions never reach the pipeline.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnalyticsDispatcher {

    private final AnalyticsPipelineService pipelineService;
    private final AttendanceProperties properties;

    @Async("analyticsExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onAttendanceSubmitted(AttendanceSubmittedEvent event) {
        if (!properties.getAnalytics().isEnabled()) {
            log.debug("Analytics disabled, ignoring session {}", event.sessionId());
            return;
        }

        try {
            pipelineService.runPipeline(event.sessionId(), event.semester(), event.subject());
        } catch (AnalyticsInfrastructureException e) {
            log.error("Analytics run for session {} aborted: {}", event.sessionId(), e.getMessage(), e);
        }
    }
}

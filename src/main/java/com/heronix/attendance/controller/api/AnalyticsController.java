package com.heronix.attendance.controller.api;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.attendance.model.dto.StandingDTO;
import com.heronix.attendance.service.AnalyticsPipelineService;
import com.heronix.attendance.service.AnalyticsPipelineService.PipelineResult;
import com.heronix.attendance.service.StandingService;
import com.heronix.attendance.service.StudentAnalysisService;
import com.heronix.attendance.service.StudentAnalysisService.SubjectAnalysis;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for analytics standings.
 */
@RestController
@RequestMapping("/api/v1/analytics")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Analytics", description = "Cached standings and pipeline re-runs")
public class AnalyticsController {

    private final AnalyticsPipelineService pipelineService;
    private final StandingService standingService;
    private final StudentAnalysisService analysisService;

    @PostMapping("/sessions/{sessionId}/run")
    @Operation(summary = "Re-run analytics", description = "Run the pipeline again for every student of a session")
    public ResponseEntity<PipelineResult> rerun(@PathVariable Long sessionId) {
        return ResponseEntity.ok(pipelineService.rerun(sessionId));
    }

    @GetMapping("/students/{studentId}/standings")
    @Operation(summary = "Student standings", description = "Cached standings of a student for all subjects")
    public ResponseEntity<List<StandingDTO>> standings(@PathVariable Long studentId) {
        return ResponseEntity.ok(standingService.findAll(studentId).stream()
                .map(StandingDTO::fromEntity)
                .toList());
    }

    @GetMapping("/students/{studentId}/analysis")
    @Operation(summary = "Subject analysis", description = "Attendance counts, cached standing and recent trend line")
    public ResponseEntity<SubjectAnalysis> analysis(
            @PathVariable Long studentId,
            @RequestParam String subject,
            @RequestParam Integer semester) {
        return ResponseEntity.ok(analysisService.analyze(studentId, subject, semester));
    }
}

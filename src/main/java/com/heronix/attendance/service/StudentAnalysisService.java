package com.heronix.attendance.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.attendance.exception.ResourceNotFoundException;
import com.heronix.attendance.model.dto.AttendanceSeriesPoint;
import com.heronix.attendance.model.dto.StandingDTO;
import com.heronix.attendance.model.enums.AttendanceStatus;
import com.heronix.attendance.repository.AttendanceRecordRepository;
import com.heronix.attendance.repository.StudentRepository;

import lombok.RequiredArgsConstructor;

/**
 * Per-student subject summary combining raw counts with the cached standing.
 */
@Service
@RequiredArgsConstructor
public class StudentAnalysisService {

    private static final int TREND_LINE_SESSIONS = 10;

    private final StudentRepository studentRepository;
    private final AttendanceRecordRepository recordRepository;
    private final StandingService standingService;

    public record TrendPoint(
            LocalDate sessionDate,
            AttendanceStatus status
    ) {}

    public record SubjectAnalysis(
            Long studentId,
            String subject,
            Integer semester,
            int totalSessions,
            int presentCount,
            int absentCount,
            BigDecimal attendancePercentage,
            StandingDTO standing,
            List<TrendPoint> recentSessions
    ) {}

    /**
     * Summarize a student's attendance in one subject. The standing is null
     * until the pipeline has succeeded once for the student.
     */
    @Transactional(readOnly = true)
    public SubjectAnalysis analyze(Long studentId, String subject, Integer semester) {
        if (!studentRepository.existsById(studentId)) {
            throw new ResourceNotFoundException("Student", studentId);
        }

        List<AttendanceSeriesPoint> series = recordRepository.findSeries(studentId, subject, semester);
        int total = series.size();
        int present = (int) series.stream().filter(p -> p.status().countsAsAttended()).count();

        BigDecimal percentage = total == 0
                ? BigDecimal.ZERO
                : BigDecimal.valueOf(present * 100L).divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);

        List<TrendPoint> recent = series.subList(Math.max(0, total - TREND_LINE_SESSIONS), total).stream()
                .map(p -> new TrendPoint(p.sessionDate(), p.status()))
                .toList();

        StandingDTO standing = standingService.find(studentId, subject, semester)
                .map(StandingDTO::fromEntity)
                .orElse(null);

        return new SubjectAnalysis(studentId, subject, semester, total, present, total - present,
                percentage, standing, recent);
    }
}

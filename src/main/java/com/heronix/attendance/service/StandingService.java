package com.heronix.attendance.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.attendance.model.domain.StudentSubjectStanding;
import com.heronix.attendance.repository.StudentSubjectStandingRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads and writes cached analytics standings.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StandingService {

    private final StudentSubjectStandingRepository standingRepository;
    private final Clock clock;

    /**
     * The four stage outputs of one successful run.
     */
    public record StageOutputs(
            String trend,
            String consistency,
            String attentiveness,
            String risk
    ) {}

    /**
     * Insert or overwrite the standing of a student for a subject and semester.
     */
    @Transactional
    public StudentSubjectStanding upsert(Long studentId, String subject, Integer semester,
                                         StageOutputs outputs, Long sourceSessionId) {
        StudentSubjectStanding standing = standingRepository
                .findByStudentIdAndSubjectAndSemester(studentId, subject, semester)
                .orElseGet(() -> StudentSubjectStanding.builder()
                        .studentId(studentId)
                        .subject(subject)
                        .semester(semester)
                        .build());

        standing.setTrend(outputs.trend());
        standing.setConsistency(outputs.consistency());
        standing.setAttentiveness(outputs.attentiveness());
        standing.setRisk(outputs.risk());
        standing.setSourceSessionId(sourceSessionId);
        standing.setComputedAt(LocalDateTime.now(clock));

        standing = standingRepository.save(standing);
        log.debug("Standing of student {} for {} (sem {}) now {}", studentId, subject, semester, outputs);
        return standing;
    }

    @Transactional(readOnly = true)
    public Optional<StudentSubjectStanding> find(Long studentId, String subject, Integer semester) {
        return standingRepository.findByStudentIdAndSubjectAndSemester(studentId, subject, semester);
    }

    @Transactional(readOnly = true)
    public List<StudentSubjectStanding> findAll(Long studentId) {
        return standingRepository.findByStudentIdOrderBySubjectAsc(studentId);
    }
}

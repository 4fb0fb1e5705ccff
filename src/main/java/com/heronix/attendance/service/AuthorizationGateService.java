package com.heronix.attendance.service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.attendance.exception.InvalidRequestException;
import com.heronix.attendance.model.domain.EnrollmentInterval;
import com.heronix.attendance.model.dto.AuthorizationDecision;
import com.heronix.attendance.model.enums.OwnerType;
import com.heronix.attendance.repository.EnrollmentIntervalRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides whether a teacher may take attendance for a class and subject on a date.
 *
 * A teacher is authorized when any of their intervals for the combination
 * covers the date. Otherwise the denial points at the nearest future start
 * if one exists, or at the latest completion.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthorizationGateService {

    private final EnrollmentIntervalRepository intervalRepository;
    private final Clock clock;

    /**
     * Authorize for today.
     */
    public AuthorizationDecision authorize(Long teacherId, Integer semester, String department,
                                           String section, String subject) {
        return authorize(teacherId, semester, department, section, subject, null);
    }

    /**
     * Authorize for a date; a null date means today.
     */
    @Transactional(readOnly = true)
    public AuthorizationDecision authorize(Long teacherId, Integer semester, String department,
                                           String section, String subject, LocalDate asOfDate) {
        if (teacherId == null || semester == null || isBlank(department) || isBlank(section) || isBlank(subject)) {
            throw new InvalidRequestException("Teacher, semester, department, section and subject are required");
        }
        LocalDate asOf = asOfDate != null ? asOfDate : LocalDate.now(clock);

        List<EnrollmentInterval> intervals = intervalRepository
                .findByOwnerTypeAndOwnerIdAndSemesterAndDepartmentAndSectionAndSubject(
                        OwnerType.TEACHER, teacherId, semester, department, section, subject);

        if (intervals.isEmpty()) {
            log.debug("Teacher {} has no assignment for {} {}-{} sem {}", teacherId, subject, department, section, semester);
            return AuthorizationDecision.notAssigned(subject, department, section, semester);
        }

        if (intervals.stream().anyMatch(i -> i.isActiveOn(asOf))) {
            return AuthorizationDecision.granted();
        }

        Optional<LocalDate> nextStart = intervals.stream()
                .map(EnrollmentInterval::getEnrollmentDate)
                .filter(d -> d.isAfter(asOf))
                .min(Comparator.naturalOrder());
        if (nextStart.isPresent()) {
            log.debug("Teacher {} assignment for {} starts on {}", teacherId, subject, nextStart.get());
            return AuthorizationDecision.notYetActive(subject, nextStart.get());
        }

        LocalDate endedOn = intervals.stream()
                .map(EnrollmentInterval::getCompletionDate)
                .filter(d -> d != null)
                .max(Comparator.naturalOrder())
                .orElse(asOf);
        log.debug("Teacher {} assignment for {} ended on {}", teacherId, subject, endedOn);
        return AuthorizationDecision.ended(subject, endedOn);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

package com.heronix.attendance.service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.attendance.exception.EnrollmentConflictException;
import com.heronix.attendance.exception.InvalidRequestException;
import com.heronix.attendance.exception.ResourceNotFoundException;
import com.heronix.attendance.model.domain.EnrollmentInterval;
import com.heronix.attendance.model.domain.Student;
import com.heronix.attendance.model.domain.Teacher;
import com.heronix.attendance.model.dto.AssignmentConflictReport;
import com.heronix.attendance.model.dto.EnrollmentIntervalDTO;
import com.heronix.attendance.model.dto.SubjectCombination;
import com.heronix.attendance.model.enums.OwnerType;
import com.heronix.attendance.repository.EnrollmentIntervalRepository;
import com.heronix.attendance.repository.StudentRepository;
import com.heronix.attendance.repository.TeacherRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates enrollment intervals for teachers and students.
 *
 * Intervals are never edited. Co-teaching a combination another teacher
 * already holds is only possible when the caller forces it, and results in
 * an additional interval.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EnrollmentService {

    private final EnrollmentIntervalRepository intervalRepository;
    private final TeacherRepository teacherRepository;
    private final StudentRepository studentRepository;
    private final Clock clock;

    /**
     * Result of an assignment.
     */
    public record AssignmentResult(
            int enrollmentCount,
            List<Long> enrollmentIds,
            boolean hadConflicts,
            String message
    ) {}

    /**
     * Find duplicates and cross-teacher conflicts for a prospective teacher assignment.
     */
    @Transactional(readOnly = true)
    public AssignmentConflictReport checkAssignmentConflicts(Long teacherId, List<SubjectCombination> combinations,
                                                             LocalDate enrollmentDate, LocalDate completionDate) {
        List<SubjectCombination> duplicates = new ArrayList<>();
        List<AssignmentConflictReport.Conflict> conflicts = new ArrayList<>();

        for (SubjectCombination combo : combinations) {
            List<EnrollmentInterval> holders = intervalRepository
                    .findByOwnerTypeAndSemesterAndDepartmentAndSectionAndSubject(
                            OwnerType.TEACHER, combo.semester(), combo.department(), combo.section(), combo.subject());

            boolean duplicate = holders.stream()
                    .anyMatch(i -> i.getOwnerId().equals(teacherId) && i.getEnrollmentDate().equals(enrollmentDate));
            if (duplicate) {
                duplicates.add(combo);
                continue;
            }

            Optional<EnrollmentInterval> other = holders.stream()
                    .filter(i -> !i.getOwnerId().equals(teacherId))
                    .filter(i -> i.overlaps(enrollmentDate, completionDate))
                    .findFirst();
            other.ifPresent(i -> {
                Teacher existing = teacherRepository.findById(i.getOwnerId()).orElse(null);
                conflicts.add(new AssignmentConflictReport.Conflict(combo, i.getOwnerId(),
                        existing != null ? existing.getTeacherCode() : null,
                        existing != null ? existing.getName() : null));
            });
        }

        return new AssignmentConflictReport(duplicates, conflicts);
    }

    /**
     * Assign subject combinations to a teacher.
     *
     * @param force create the intervals even when other teachers hold overlapping ones
     * @throws EnrollmentConflictException on duplicates, or on conflicts without force
     */
    @Transactional
    public AssignmentResult assignTeacher(String teacherCode, List<SubjectCombination> combinations,
                                          LocalDate enrollmentDate, LocalDate completionDate, boolean force) {
        if (teacherCode == null || teacherCode.isBlank() || combinations == null || combinations.isEmpty()) {
            throw new InvalidRequestException("Please provide teacher ID and subject combinations");
        }
        validateDates(enrollmentDate, completionDate);

        String code = teacherCode.trim();
        if (code.length() < 3) {
            throw new InvalidRequestException("Teacher ID must be at least 3 characters long");
        }

        Teacher teacher = teacherRepository.findByTeacherCode(code)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Teacher ID not registered in the system. Please register the teacher first."));

        AssignmentConflictReport report = checkAssignmentConflicts(
                teacher.getId(), combinations, enrollmentDate, completionDate);

        if (report.hasDuplicates()) {
            throw new EnrollmentConflictException(
                    "Teacher " + code + " is already assigned to these subjects", report);
        }
        if (report.hasConflicts() && !force) {
            throw new EnrollmentConflictException("Some subjects are already assigned to other teachers", report);
        }
        if (report.hasConflicts()) {
            log.warn("Forcing assignment of teacher {} despite {} conflict(s)", code, report.conflicts().size());
        }

        List<Long> ids = new ArrayList<>();
        for (SubjectCombination combo : combinations) {
            EnrollmentInterval interval = intervalRepository.save(EnrollmentInterval.builder()
                    .ownerType(OwnerType.TEACHER)
                    .ownerId(teacher.getId())
                    .semester(combo.semester())
                    .department(combo.department())
                    .section(combo.section())
                    .subject(combo.subject())
                    .enrollmentDate(enrollmentDate)
                    .completionDate(completionDate)
                    .build());
            ids.add(interval.getId());
        }

        log.info("Assigned {} subject(s) to teacher {} from {} to {}", ids.size(), code, enrollmentDate, completionDate);
        return new AssignmentResult(ids.size(), ids, report.hasConflicts(), "Teacher subjects assigned successfully");
    }

    /**
     * Enroll a student in a semester, one interval per subject.
     *
     * A student has at most one semester assignment per semester number and
     * per enrollment month.
     */
    @Transactional
    public AssignmentResult assignStudentSemester(String usn, Integer semester, String department, String section,
                                                  List<String> subjects, LocalDate enrollmentDate,
                                                  LocalDate completionDate) {
        if (usn == null || usn.isBlank() || semester == null || department == null || department.isBlank()
                || section == null || section.isBlank() || subjects == null || subjects.isEmpty()) {
            throw new InvalidRequestException(
                    "Please provide student ID, section, semester, department, and subjects");
        }
        validateDates(enrollmentDate, completionDate);

        Student student = studentRepository.findByUsn(usn)
                .orElseThrow(() -> new ResourceNotFoundException("Student ID not registered"));

        YearMonth month = YearMonth.from(enrollmentDate);
        if (intervalRepository.existsStartingInRange(OwnerType.STUDENT, student.getId(),
                month.atDay(1), month.atEndOfMonth())) {
            throw new EnrollmentConflictException(String.format(
                    "Student is already enrolled for %s %d. A student cannot have two semester enrollments at the same date.",
                    month.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH), month.getYear()));
        }

        if (intervalRepository.existsByOwnerTypeAndOwnerIdAndSemester(OwnerType.STUDENT, student.getId(), semester)) {
            throw new EnrollmentConflictException(String.format(
                    "Student is already enrolled in Semester %d. A student cannot enroll in the same semester twice.",
                    semester));
        }

        List<Long> ids = new ArrayList<>();
        for (String subject : subjects) {
            EnrollmentInterval interval = intervalRepository.save(EnrollmentInterval.builder()
                    .ownerType(OwnerType.STUDENT)
                    .ownerId(student.getId())
                    .semester(semester)
                    .department(department)
                    .section(section)
                    .subject(subject)
                    .enrollmentDate(enrollmentDate)
                    .completionDate(completionDate)
                    .build());
            ids.add(interval.getId());
        }

        log.info("Enrolled student {} in semester {} ({}-{}) with {} subject(s)",
                usn, semester, department, section, ids.size());
        return new AssignmentResult(ids.size(), ids, false, "Student semester assignment successful");
    }

    /**
     * Intervals of an owner, most recent first.
     */
    @Transactional(readOnly = true)
    public List<EnrollmentIntervalDTO> listIntervals(OwnerType ownerType, Long ownerId) {
        LocalDate today = LocalDate.now(clock);
        return intervalRepository.findByOwnerTypeAndOwnerIdOrderByEnrollmentDateDesc(ownerType, ownerId)
                .stream()
                .map(i -> EnrollmentIntervalDTO.fromEntity(i, today))
                .toList();
    }

    private void validateDates(LocalDate enrollmentDate, LocalDate completionDate) {
        if (enrollmentDate == null || completionDate == null) {
            throw new InvalidRequestException("Enrollment date and completion date are required");
        }
        if (completionDate.isBefore(enrollmentDate)) {
            throw new InvalidRequestException("Completion date must not be before enrollment date");
        }
    }
}

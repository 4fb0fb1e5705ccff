package com.heronix.attendance.controller.api;

import java.time.LocalDate;
import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.attendance.exception.ResourceNotFoundException;
import com.heronix.attendance.model.dto.AssignmentConflictReport;
import com.heronix.attendance.model.dto.EnrollmentIntervalDTO;
import com.heronix.attendance.model.dto.SubjectCombination;
import com.heronix.attendance.model.enums.OwnerType;
import com.heronix.attendance.repository.TeacherRepository;
import com.heronix.attendance.service.EnrollmentService;
import com.heronix.attendance.service.EnrollmentService.AssignmentResult;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for teacher and student enrollment intervals.
 */
@RestController
@RequestMapping("/api/v1/enrollments")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Enrollments", description = "Teacher assignments and student semester enrollment")
public class EnrollmentController {

    private final EnrollmentService enrollmentService;
    private final TeacherRepository teacherRepository;

    @PostMapping("/teachers/conflicts")
    @Operation(summary = "Check assignment conflicts", description = "Report duplicates and other teachers' overlapping assignments")
    public ResponseEntity<AssignmentConflictReport> checkConflicts(@Valid @RequestBody TeacherAssignmentRequest request) {
        Long teacherId = teacherRepository.findByTeacherCode(request.teacherCode().trim())
                .orElseThrow(() -> new ResourceNotFoundException("Teacher", request.teacherCode()))
                .getId();
        return ResponseEntity.ok(enrollmentService.checkAssignmentConflicts(teacherId,
                request.subjectCombinations(), request.enrollmentDate(), request.completionDate()));
    }

    @PostMapping("/teachers")
    @Operation(summary = "Assign subjects", description = "Assign subject combinations to a teacher")
    @ApiResponse(responseCode = "201", description = "Assignments created")
    @ApiResponse(responseCode = "409", description = "Duplicate, or conflict without forceAssign")
    public ResponseEntity<AssignmentResult> assignTeacher(@Valid @RequestBody TeacherAssignmentRequest request) {
        log.info("Assigning {} combination(s) to teacher {}", request.subjectCombinations().size(), request.teacherCode());
        AssignmentResult result = enrollmentService.assignTeacher(request.teacherCode(), request.subjectCombinations(),
                request.enrollmentDate(), request.completionDate(), request.forceAssign());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @PostMapping("/students")
    @Operation(summary = "Assign semester", description = "Enroll a student in a semester's subjects")
    @ApiResponse(responseCode = "201", description = "Enrollment created")
    @ApiResponse(responseCode = "409", description = "Semester or enrollment month already taken")
    public ResponseEntity<AssignmentResult> assignStudent(@Valid @RequestBody StudentSemesterRequest request) {
        AssignmentResult result = enrollmentService.assignStudentSemester(request.usn(), request.semester(),
                request.department(), request.section(), request.subjects(),
                request.enrollmentDate(), request.completionDate());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @GetMapping("/teachers/{teacherId}")
    public ResponseEntity<List<EnrollmentIntervalDTO>> teacherIntervals(@PathVariable Long teacherId) {
        return ResponseEntity.ok(enrollmentService.listIntervals(OwnerType.TEACHER, teacherId));
    }

    @GetMapping("/students/{studentId}")
    public ResponseEntity<List<EnrollmentIntervalDTO>> studentIntervals(@PathVariable Long studentId) {
        return ResponseEntity.ok(enrollmentService.listIntervals(OwnerType.STUDENT, studentId));
    }

    // ========================================================================
    // REQUEST/RESPONSE TYPES
    // ========================================================================

    public record TeacherAssignmentRequest(
            @NotBlank String teacherCode,
            @NotEmpty List<@Valid SubjectCombination> subjectCombinations,
            @NotNull LocalDate enrollmentDate,
            @NotNull LocalDate completionDate,
            boolean forceAssign
    ) {}

    public record StudentSemesterRequest(
            @NotBlank String usn,
            @NotNull Integer semester,
            @NotBlank String department,
            @NotBlank String section,
            @NotEmpty List<String> subjects,
            @NotNull LocalDate enrollmentDate,
            @NotNull LocalDate completionDate
    ) {}
}

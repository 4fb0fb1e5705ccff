package com.heronix.attendance.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * A (semester, department, section, subject) tuple a teacher or student can be enrolled in.
 */
public record SubjectCombination(
        @NotNull @Min(1) @Max(8) Integer semester,
        @NotBlank String department,
        @NotBlank String section,
        @NotBlank String subject
) {
    @Override
    public String toString() {
        return subject + " (" + department + "-" + section + ", Semester " + semester + ")";
    }
}

package com.heronix.attendance.model.dto;

import java.util.List;

/**
 * Result of checking a teacher assignment against existing intervals.
 *
 * @param duplicates combinations the same teacher already holds from the same enrollment date
 * @param conflicts  combinations another teacher holds over an overlapping period
 */
public record AssignmentConflictReport(
        List<SubjectCombination> duplicates,
        List<Conflict> conflicts
) {
    public record Conflict(
            SubjectCombination combination,
            Long existingTeacherId,
            String existingTeacherCode,
            String existingTeacherName
    ) {}

    public boolean hasDuplicates() {
        return !duplicates.isEmpty();
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}

package com.heronix.attendance.model.dto;

import java.time.LocalDate;

import com.heronix.attendance.model.enums.DenialReason;

/**
 * Outcome of the enrollment authorization gate.
 *
 * @param authorized  whether the teacher may take attendance
 * @param reason      denial reason, null when authorized
 * @param activatesOn start of the earliest future interval for NOT_YET_ACTIVE
 * @param endedOn     completion date of the latest interval for ENDED
 * @param message     human readable explanation
 */
public record AuthorizationDecision(
        boolean authorized,
        DenialReason reason,
        LocalDate activatesOn,
        LocalDate endedOn,
        String message
) {
    public static AuthorizationDecision granted() {
        return new AuthorizationDecision(true, null, null, null, "Authorized");
    }

    public static AuthorizationDecision notAssigned(String subject, String department, String section, Integer semester) {
        return new AuthorizationDecision(false, DenialReason.NOT_ASSIGNED, null, null,
                String.format("You are not assigned to teach %s for %s-%s, Semester %d",
                        subject, department, section, semester));
    }

    public static AuthorizationDecision notYetActive(String subject, LocalDate activatesOn) {
        return new AuthorizationDecision(false, DenialReason.NOT_YET_ACTIVE, activatesOn, null,
                String.format("Your assignment for %s has not started yet. It begins on %s.",
                        subject, activatesOn));
    }

    public static AuthorizationDecision ended(String subject, LocalDate endedOn) {
        return new AuthorizationDecision(false, DenialReason.ENDED, null, endedOn,
                String.format("Your assignment for %s ended on %s. You are no longer authorized to take attendance for this class.",
                        subject, endedOn));
    }
}

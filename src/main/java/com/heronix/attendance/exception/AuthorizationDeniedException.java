package com.heronix.attendance.exception;

import com.heronix.attendance.model.dto.AuthorizationDecision;

/**
 * Exception thrown when the authorization gate refuses a teacher.
 */
public class AuthorizationDeniedException extends RuntimeException {

    private final transient AuthorizationDecision decision;

    public AuthorizationDeniedException(AuthorizationDecision decision) {
        super(decision.message());
        this.decision = decision;
    }

    public AuthorizationDecision getDecision() {
        return decision;
    }
}

package com.heronix.attendance.exception;

import com.heronix.attendance.model.dto.WindowCheck;

/**
 * Exception thrown when a session is opened outside its period's attendance window.
 */
public class TimeWindowDeniedException extends RuntimeException {

    private final transient WindowCheck check;

    public TimeWindowDeniedException(WindowCheck check) {
        super(check.reason());
        this.check = check;
    }

    public WindowCheck getCheck() {
        return check;
    }
}

package com.heronix.attendance.exception;

import com.heronix.attendance.model.enums.StageType;

/**
 * Exception thrown when one inference stage fails, times out or returns no usable value.
 * Fails the run of a single student only.
 */
public class StageInvocationException extends RuntimeException {

    private final StageType stage;

    public StageInvocationException(StageType stage, String message) {
        super(stage.getOutputField() + " stage failed: " + message);
        this.stage = stage;
    }

    public StageInvocationException(StageType stage, String message, Throwable cause) {
        super(stage.getOutputField() + " stage failed: " + message, cause);
        this.stage = stage;
    }

    public StageType getStage() {
        return stage;
    }
}

package com.heronix.attendance.adapter.inference;

import com.heronix.attendance.model.enums.StageTransport;
import com.heronix.attendance.model.enums.StageType;

/**
 * Interface for invoking one analytics inference stage.
 *
 * A stage receives a JSON object and answers with one JSON object that
 * carries its result under {@link StageType#getOutputField()}. The value is
 * opaque to the caller.
 */
public interface InferenceStageClient {

    /**
     * Get the transport this client implements.
     */
    StageTransport getTransport();

    /**
     * Invoke a stage and return its output value.
     *
     * Implementations block the calling thread until the stage answers or
     * the configured stage timeout elapses.
     *
     * @param stage   the stage to run
     * @param payload JSON-serializable input: the series itself for trend and consistency, an object otherwise
     * @return the raw output value (may be null or blank when the stage misbehaves)
     * @throws com.heronix.attendance.exception.StageInvocationException on transport failure, timeout or bad output
     */
    String invoke(StageType stage, Object payload);
}

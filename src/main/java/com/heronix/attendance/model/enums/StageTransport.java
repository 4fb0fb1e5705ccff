package com.heronix.attendance.model.enums;

/**
 * How inference stages are reached.
 */
public enum StageTransport {

    /**
     * Remote inference service, one POST per stage
     */
    HTTP,

    /**
     * Local worker process per invocation, JSON over stdin/stdout
     */
    PROCESS
}

package com.air.normaliser.common.exception;

import lombok.Getter;

/**
 * Thrown when a resampling trial fails. The whole ensemble is abandoned.
 */
@Getter
public class WorkerFailureException extends NormaliserException {
    private static final String DEFAULT_ERROR_CODE = "ERR-WRK-001";

    /**
     * 1-based id of the failed trial, or 0 when the failure is not tied to one trial.
     */
    private final int trialId;

    public WorkerFailureException(int trialId, Throwable cause) {
        super(String.format("Trial %d failed: %s", trialId, describe(cause)), cause);
        this.trialId = trialId;
    }

    public WorkerFailureException(String message, Throwable cause) {
        super(message, cause);
        this.trialId = 0;
    }

    private static String describe(Throwable t) {
        if (t == null) return "Unknown error";
        return t.getMessage() == null ? t.toString() : t.getMessage();
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}

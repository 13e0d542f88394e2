package com.air.normaliser.common.exception;

/**
 * Thrown when a dataset or a call option does not have the shape a normalisation needs.
 */
public class InvalidInputException extends NormaliserException {
    private static final String DEFAULT_ERROR_CODE = "ERR-INP-001";

    public InvalidInputException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}

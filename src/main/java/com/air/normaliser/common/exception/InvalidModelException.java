package com.air.normaliser.common.exception;

/**
 * Thrown when the supplied model cannot act as a predictive surrogate.
 */
public class InvalidModelException extends NormaliserException {
    private static final String DEFAULT_ERROR_CODE = "ERR-MDL-001";

    public InvalidModelException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}

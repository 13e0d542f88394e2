package com.air.normaliser.common.exception;

/**
 * Thrown when standard errors are requested from a model that cannot estimate variance.
 */
public class UnsupportedModelOperationException extends NormaliserException {
    private static final String DEFAULT_ERROR_CODE = "ERR-MDL-002";

    public UnsupportedModelOperationException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}

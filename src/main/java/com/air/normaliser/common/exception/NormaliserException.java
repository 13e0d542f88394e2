package com.air.normaliser.common.exception;

import lombok.Getter;

/**
 * Base exception for all normalisation failures.
 * Every failure carries an error code so callers can branch without parsing messages.
 */
@Getter
public abstract class NormaliserException extends RuntimeException {

    private final String errorCode;

    protected NormaliserException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected NormaliserException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    /**
     * Each subclass must provide a default error code.
     */
    protected abstract String getDefaultErrorCode();
}

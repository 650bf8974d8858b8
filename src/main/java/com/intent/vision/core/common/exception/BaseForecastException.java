package com.intent.vision.core.common.exception;

import lombok.Getter;

/**
 * Base exception for every fatal error raised by the forecast and alerting core.
 * Carries a stable error code so callers can map it without parsing messages.
 */
@Getter
public abstract class BaseForecastException extends RuntimeException {

    private final String errorCode;

    protected BaseForecastException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected BaseForecastException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    /**
     * Each subclass must provide a default error code.
     */
    protected abstract String getDefaultErrorCode();
}

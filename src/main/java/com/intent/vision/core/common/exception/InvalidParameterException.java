package com.intent.vision.core.common.exception;

/**
 * Bad horizon, method, confidence level, plan or alert rule shape.
 */
public class InvalidParameterException extends BaseForecastException {
    private static final String DEFAULT_ERROR_CODE = "ERR-VAL-001";

    public InvalidParameterException(String message) {
        super(message);
    }

    public InvalidParameterException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}

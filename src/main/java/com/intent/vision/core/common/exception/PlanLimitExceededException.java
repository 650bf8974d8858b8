package com.intent.vision.core.common.exception;

/**
 * History size or horizon is larger than the organization's plan allows.
 * Never downgraded to a fallback backend.
 */
public class PlanLimitExceededException extends BaseForecastException {
    private static final String DEFAULT_ERROR_CODE = "ERR-PLAN-001";

    public PlanLimitExceededException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}

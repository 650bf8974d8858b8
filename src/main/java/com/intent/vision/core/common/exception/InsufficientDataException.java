package com.intent.vision.core.common.exception;

/**
 * Thrown when a forecast is requested with fewer history points than a method needs.
 */
public class InsufficientDataException extends BaseForecastException {
    private static final String DEFAULT_ERROR_CODE = "ERR-FC-001";

    public InsufficientDataException(String message) {
        super(message);
    }

    public InsufficientDataException(int available, int required) {
        super(String.format("Insufficient data points for forecasting: %d available, minimum %d required",
                available, required));
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}

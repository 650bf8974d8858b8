package com.intent.vision.core.common.exception;

import com.intent.vision.core.enums.ForecastBackendType;
import lombok.Getter;

/**
 * A paid remote forecast backend failed, returned garbage or is not configured.
 */
@Getter
public class RemoteBackendException extends BaseForecastException {
    private static final String DEFAULT_ERROR_CODE = "ERR-BE-001";

    private final ForecastBackendType backend;

    public RemoteBackendException(ForecastBackendType backend, String message) {
        super(message);
        this.backend = backend;
    }

    public RemoteBackendException(ForecastBackendType backend, String message, Throwable cause) {
        super(message, cause);
        this.backend = backend;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}

package com.intent.vision.core.service.forecast;

import com.intent.vision.core.dto.Forecast;
import com.intent.vision.core.dto.ForecastRequest;
import com.intent.vision.core.enums.ForecastBackendType;

/**
 * One forecasting backend. Implementations are resolved once per request from
 * the backend chosen by the selector.
 */
public interface ForecastEngine {

    ForecastBackendType backend();

    /**
     * @throws com.intent.vision.core.common.exception.InsufficientDataException fewer than 2 points
     * @throws com.intent.vision.core.common.exception.InvalidParameterException  non-positive horizon, bad confidence level
     * @throws com.intent.vision.core.common.exception.RemoteBackendException     remote backend failure
     */
    Forecast forecast(ForecastRequest request);
}

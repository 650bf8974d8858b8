package com.intent.vision.core.service.forecast;

import com.intent.vision.core.dto.ForecastPrediction;
import com.intent.vision.core.dto.TimeSeriesPoint;
import com.intent.vision.core.enums.ForecastBackendType;

import java.util.List;

/**
 * Opaque paid forecasting API. The wire format belongs to the implementation.
 */
public interface RemoteForecastClient {

    ForecastBackendType backend();

    boolean isConfigured();

    /**
     * @throws com.intent.vision.core.common.exception.RemoteBackendException on any remote failure
     */
    List<ForecastPrediction> callBackend(List<TimeSeriesPoint> points, int horizonDays, double confidenceLevel);
}

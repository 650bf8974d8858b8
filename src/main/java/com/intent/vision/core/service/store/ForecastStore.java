package com.intent.vision.core.service.store;

import com.intent.vision.core.dto.Forecast;

import java.util.Optional;

public interface ForecastStore {

    /**
     * Persists a completed forecast and returns its id.
     */
    String saveForecast(String orgId, String metricName, Forecast forecast);

    Optional<Forecast> getLatestForecast(String orgId, String metricName);
}

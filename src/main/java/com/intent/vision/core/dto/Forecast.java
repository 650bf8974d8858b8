package com.intent.vision.core.dto;

import com.intent.vision.core.enums.ForecastBackendType;

import java.util.List;

/**
 * Immutable result of a forecast run, handed to the persistence layer as is.
 */
public record Forecast(
        List<ForecastPrediction> predictions,
        ModelInfo modelInfo,
        ForecastBackendType backend,
        ForecastRunMetrics metrics
) {
    public Forecast {
        predictions = predictions == null ? List.of() : List.copyOf(predictions);
    }
}

package com.intent.vision.core.dto;

public record ForecastRun(String forecastId, Forecast forecast, BackendSelectionResult selection) {
}

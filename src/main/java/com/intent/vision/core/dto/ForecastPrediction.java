package com.intent.vision.core.dto;

import java.time.Instant;

public record ForecastPrediction(
        Instant timestamp,
        double predictedValue,
        double confidenceLower,
        double confidenceUpper
) {
    public double bandWidth() {
        return confidenceUpper - confidenceLower;
    }
}

package com.intent.vision.core.dto;

public record ForecastRunMetrics(int inputPoints, int outputPoints, long durationMs) {
}

package com.intent.vision.core.dto;

import com.intent.vision.core.enums.ForecastMethod;

import java.util.List;

/**
 * Input of a single forecast run. {@code confidenceLevel} and {@code method}
 * may be null, in which case the engine defaults apply.
 */
public record ForecastRequest(
        List<TimeSeriesPoint> points,
        int horizonDays,
        Double confidenceLevel,
        ForecastMethod method
) {
    public ForecastRequest {
        points = points == null ? List.of() : List.copyOf(points);
    }

    public static ForecastRequest of(List<TimeSeriesPoint> points, int horizonDays, ForecastMethod method) {
        return new ForecastRequest(points, horizonDays, null, method);
    }
}

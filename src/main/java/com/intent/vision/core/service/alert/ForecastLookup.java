package com.intent.vision.core.service.alert;

import com.intent.vision.core.dto.Forecast;

import java.util.Optional;

/**
 * Latest completed forecast of a metric, if any.
 */
@FunctionalInterface
public interface ForecastLookup {

    Optional<Forecast> latestFor(String metricName);
}

package com.intent.vision.core.dto;

import com.intent.vision.core.enums.ForecastBackendType;
import com.intent.vision.core.enums.ForecastMethod;
import lombok.Builder;
import lombok.Value;

/**
 * Caller options for the fetch-select-run-persist pipeline.
 */
@Value
@Builder
public class ForecastOptions {

    String metricName;
    ForecastBackendType requestedBackend;
    int horizonDays;
    Double confidenceLevel;
    ForecastMethod method;
    Integer historyLimit;
    boolean fallbackToStatisticalOnError;
}

package com.intent.vision.core.dto;

import com.intent.vision.core.enums.ForecastBackendType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class BackendSelectionResult {

    ForecastBackendType selectedBackend;
    String rationale;
    ForecastBackendType fallbackFrom;
    String warning;
    CostEstimate costEstimate;

    public boolean isFallback() {
        return fallbackFrom != null;
    }
}

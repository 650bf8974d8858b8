package com.intent.vision.core.service.backend;

import com.intent.vision.core.dto.CostEstimate;
import com.intent.vision.core.enums.ForecastBackendType;
import org.springframework.stereotype.Component;

/**
 * Rough per-call price of a backend, scaled by request size and capped.
 */
@Component
public class CostEstimator {

    static final double USD_PER_CREDIT = 0.01;

    public CostEstimate estimate(ForecastBackendType backend, int historyPoints, int horizonDays) {
        int credits = switch (backend) {
            case STATISTICAL -> 0;
            case NIXTLA -> (int) Math.ceil(Math.min(
                    1.0 + historyPoints / 1000.0 * 0.1 + horizonDays / 100.0 * 0.05, 2.0));
            case LLM -> (int) Math.ceil(5.0 * Math.min(
                    1.0 + historyPoints / 500.0 * 0.2 + horizonDays / 50.0 * 0.1, 3.0));
        };
        if (credits == 0) {
            return CostEstimate.FREE;
        }
        return new CostEstimate(credits, credits * USD_PER_CREDIT);
    }
}

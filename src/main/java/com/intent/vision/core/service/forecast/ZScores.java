package com.intent.vision.core.service.forecast;

import com.intent.vision.core.common.exception.InvalidParameterException;
import lombok.extern.slf4j.Slf4j;

/**
 * Two-sided normal quantiles for the confidence levels the product offers.
 */
@Slf4j
final class ZScores {

    private static final double[][] TABLE = {
            {0.80, 1.28},
            {0.85, 1.44},
            {0.90, 1.645},
            {0.95, 1.96},
            {0.99, 2.576},
    };
    private static final double FALLBACK = 1.96;

    private ZScores() {
    }

    static double forConfidence(double level) {
        if (!(level > 0.0 && level < 1.0)) {
            throw new InvalidParameterException("confidenceLevel must be in (0, 1), got " + level);
        }
        for (double[] row : TABLE) {
            if (Math.abs(row[0] - level) < 1e-9) {
                return row[1];
            }
        }
        log.warn("Unsupported confidence level {}; using z={}", level, FALLBACK);
        return FALLBACK;
    }
}

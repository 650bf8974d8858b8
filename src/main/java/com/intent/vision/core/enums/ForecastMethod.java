package com.intent.vision.core.enums;

import com.intent.vision.core.common.exception.InvalidParameterException;

import java.util.Locale;

/**
 * Statistical forecasting methods understood by the local engine.
 */
public enum ForecastMethod {
    SMA,    // simple moving average over a trailing window
    EWMA,   // exponentially weighted moving average, flat extrapolation
    LINEAR; // least-squares trend over a trailing window

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ForecastMethod fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        for (ForecastMethod m : values()) {
            if (m.code().equalsIgnoreCase(code.trim())) {
                return m;
            }
        }
        throw new InvalidParameterException("Unknown forecast method: " + code + " (expected sma, ewma or linear)");
    }
}

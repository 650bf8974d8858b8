package com.intent.vision.core.enums;

import com.intent.vision.core.common.exception.InvalidParameterException;

import java.util.Locale;

/**
 * Closed set of forecast backends a request can be routed to.
 */
public enum ForecastBackendType {
    STATISTICAL(false),
    NIXTLA(true),
    LLM(true);

    private final boolean paid;

    ForecastBackendType(boolean paid) {
        this.paid = paid;
    }

    /**
     * Paid backends cost money per call and are metered per organization and day.
     */
    public boolean isPaid() {
        return paid;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ForecastBackendType fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        String c = code.trim().toLowerCase(Locale.ROOT);
        // "timegpt" is the product name of the Nixtla backend
        if ("timegpt".equals(c)) {
            return NIXTLA;
        }
        for (ForecastBackendType b : values()) {
            if (b.code().equals(c)) {
                return b;
            }
        }
        throw new InvalidParameterException("Unknown forecast backend: " + code);
    }
}

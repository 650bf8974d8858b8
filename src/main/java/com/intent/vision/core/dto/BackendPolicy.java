package com.intent.vision.core.dto;

import com.intent.vision.core.enums.ForecastBackendType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Static per-plan routing policy.
 * <p>
 * Daily limits: {@code 0} = unlimited, {@code -1} = disabled, {@code > 0} = calls per day.
 * {@code maxHistoryPoints = 0} means unlimited.
 */
public record BackendPolicy(
        ForecastBackendType defaultBackend,
        Set<ForecastBackendType> allowedBackends,
        Map<ForecastBackendType, Integer> dailyLimits,
        int maxHistoryPoints,
        int maxHorizonDays
) {
    public static final int UNLIMITED = 0;
    public static final int DISABLED = -1;

    public BackendPolicy {
        if (!allowedBackends.contains(ForecastBackendType.STATISTICAL)) {
            throw new IllegalArgumentException("statistical backend must be allowed on every plan");
        }
        if (!allowedBackends.contains(defaultBackend)) {
            throw new IllegalArgumentException("default backend " + defaultBackend + " is not in allowed backends");
        }
        allowedBackends = Collections.unmodifiableSet(EnumSet.copyOf(allowedBackends));
        Map<ForecastBackendType, Integer> limits = new EnumMap<>(ForecastBackendType.class);
        if (dailyLimits != null) {
            limits.putAll(dailyLimits);
        }
        dailyLimits = Collections.unmodifiableMap(limits);
    }

    public boolean isAllowed(ForecastBackendType backend) {
        return allowedBackends.contains(backend);
    }

    public int dailyLimit(ForecastBackendType backend) {
        if (backend == ForecastBackendType.STATISTICAL) {
            return UNLIMITED;
        }
        return dailyLimits.getOrDefault(backend, DISABLED);
    }

    /**
     * True when the backend has a finite daily budget (neither unlimited nor disabled).
     */
    public boolean isMetered(ForecastBackendType backend) {
        return dailyLimit(backend) > 0;
    }
}

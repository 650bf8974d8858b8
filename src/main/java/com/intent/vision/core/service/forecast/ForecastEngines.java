package com.intent.vision.core.service.forecast;

import com.intent.vision.core.common.exception.RemoteBackendException;
import com.intent.vision.core.enums.ForecastBackendType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Backend type to engine lookup, built once from every engine bean.
 */
@Component
public class ForecastEngines {

    private final Map<ForecastBackendType, ForecastEngine> engines = new EnumMap<>(ForecastBackendType.class);

    public ForecastEngines(List<ForecastEngine> all) {
        for (ForecastEngine e : all) {
            if (engines.putIfAbsent(e.backend(), e) != null) {
                throw new IllegalStateException("Duplicate forecast engine for backend " + e.backend());
            }
        }
        if (!engines.containsKey(ForecastBackendType.STATISTICAL)) {
            throw new IllegalStateException("Statistical forecast engine is required");
        }
    }

    public ForecastEngine resolve(ForecastBackendType backend) {
        ForecastEngine engine = engines.get(backend);
        if (engine == null) {
            throw new RemoteBackendException(backend, "No forecast engine registered for backend " + backend.code());
        }
        return engine;
    }

    public ForecastEngine statistical() {
        return engines.get(ForecastBackendType.STATISTICAL);
    }
}

package com.intent.vision.core.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ModelInfo(String name, String version, Map<String, Object> parameters) {

    public ModelInfo {
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}

package com.intent.vision.core.dto;

import java.time.Instant;
import java.util.Objects;

public record TimeSeriesPoint(Instant timestamp, double value) {

    public TimeSeriesPoint {
        Objects.requireNonNull(timestamp, "timestamp");
    }
}

package com.intent.vision.core.dto;

import com.intent.vision.core.enums.ForecastBackendType;

import java.time.LocalDate;

public record UsageCounter(String orgId, ForecastBackendType backend, LocalDate day, long count) {
}

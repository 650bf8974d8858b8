package com.intent.vision.core.dto;

import com.intent.vision.core.enums.ForecastBackendType;

import java.time.LocalDate;

/**
 * One call held against a daily quota. Pinned to the day it was taken on,
 * so giving it back after midnight still hits the right counter.
 */
public record UsageReservation(String orgId, ForecastBackendType backend, LocalDate day) {
}

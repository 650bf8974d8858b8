package com.intent.vision.core.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * Alert rule as stored or submitted: either {@code condition} or the legacy
 * {@code direction + threshold} pair must be present.
 */
public record AlertRuleInput(
        String id,
        String orgId,

        @NotBlank(message = "metricName cannot be blank")
        String metricName,

        ConditionInput condition,
        String direction,
        Double threshold,

        @Positive(message = "horizonDays must be positive")
        int horizonDays,

        List<@Valid @NotNull(message = "channel is required") NotificationChannel> channels,
        Boolean enabled,
        String description
) {
    public record ConditionInput(String operator, Double value) {
    }
}

package com.intent.vision.core.dto;

/**
 * Rendered notification, built once per triggered rule and shared by all channels.
 */
public record AlertContent(
        String subject,
        String textBody,
        String htmlBody,
        String metricName,
        double triggerValue,
        AlertCondition condition,
        int horizonDays
) {
}

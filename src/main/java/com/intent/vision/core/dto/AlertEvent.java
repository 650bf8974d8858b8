package com.intent.vision.core.dto;

import com.intent.vision.core.enums.DeliveryStatus;

import java.time.Instant;
import java.util.List;

/**
 * One firing of a rule. Created fresh on every trigger.
 */
public record AlertEvent(
        String id,
        String orgId,
        String ruleId,
        String metricName,
        Instant triggeredAt,
        double triggerValue,
        AlertCondition condition,
        List<ChannelDeliveryResult> channelResults,
        DeliveryStatus overallStatus
) {
    public AlertEvent {
        channelResults = channelResults == null ? List.of() : List.copyOf(channelResults);
    }
}

package com.intent.vision.core.dto;

import com.intent.vision.core.enums.ChannelType;
import com.intent.vision.core.enums.DeliveryStatus;

import java.util.List;

public record ChannelDeliveryResult(
        ChannelType channelType,
        DeliveryStatus status,
        String externalId,
        String error,
        List<String> recipients
) {
    public ChannelDeliveryResult {
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
    }

    public static ChannelDeliveryResult sent(NotificationChannel ch, String externalId) {
        return new ChannelDeliveryResult(ch.type(), DeliveryStatus.SENT, externalId, null, ch.recipients());
    }

    public static ChannelDeliveryResult failed(NotificationChannel ch, String error) {
        return new ChannelDeliveryResult(ch.type(), DeliveryStatus.FAILED, null, error, ch.recipients());
    }

    public static ChannelDeliveryResult skipped(NotificationChannel ch, String reason) {
        return new ChannelDeliveryResult(ch.type(), DeliveryStatus.SKIPPED, null, reason, ch.recipients());
    }

    /**
     * Failed result for a channel that cannot be delivered at all, such as one without a type.
     */
    public static ChannelDeliveryResult invalid(NotificationChannel ch, String error) {
        return new ChannelDeliveryResult(ch == null ? null : ch.type(), DeliveryStatus.FAILED, null, error,
                ch == null ? null : ch.recipients());
    }

    public boolean isSent() {
        return status == DeliveryStatus.SENT;
    }
}

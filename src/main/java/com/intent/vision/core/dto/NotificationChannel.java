package com.intent.vision.core.dto;

import com.intent.vision.core.enums.ChannelType;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * One delivery target of a rule. For email the recipients are addresses,
 * for webhook they are URLs.
 */
public record NotificationChannel(
        @NotNull(message = "channel type is required")
        ChannelType type,
        List<String> recipients,
        boolean enabled
) {

    public NotificationChannel {
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
    }
}

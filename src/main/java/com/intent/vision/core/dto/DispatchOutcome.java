package com.intent.vision.core.dto;

import com.intent.vision.core.enums.DeliveryStatus;

import java.util.List;

public record DispatchOutcome(List<ChannelDeliveryResult> channelResults, DeliveryStatus overallStatus) {

    public DispatchOutcome {
        channelResults = List.copyOf(channelResults);
    }
}

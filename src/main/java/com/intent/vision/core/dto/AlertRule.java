package com.intent.vision.core.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class AlertRule {

    String id;
    String orgId;
    String metricName;
    AlertCondition condition;
    int horizonDays;
    @Singular
    List<NotificationChannel> channels;
    boolean enabled;
    String description;
}

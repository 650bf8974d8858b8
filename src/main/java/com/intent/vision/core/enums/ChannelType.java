package com.intent.vision.core.enums;

import java.util.Locale;

public enum ChannelType {
    EMAIL,
    WEBHOOK,
    SLACK,
    SMS,
    PAGERDUTY;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package com.intent.vision.core.bus;

public final class EventBusConfig {

    private EventBusConfig() {
    }

    public static final String TOPIC_FORECAST_COMPLETED = "forecast_completed";

    public static final String TOPIC_ALERT_FIRED = "alert_fired";

    public static final String TOPIC_BACKEND_USAGE = "backend_usage";
}

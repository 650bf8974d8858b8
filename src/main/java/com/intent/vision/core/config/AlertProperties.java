package com.intent.vision.core.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties("intentvision.alerts")
public class AlertProperties {

    /**
     * Minimum time between two deliveries of the same rule. Zero fires on every
     * evaluation that matches.
     */
    private Duration refireSuppressionWindow = Duration.ZERO;

    private String dashboardUrl = "https://app.intentvision.io/dashboard";
}

package com.intent.vision.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "intentvision.notifications")
public class NotificationProperties {

    private Email email = new Email();
    private Webhook webhook = new Webhook();

    /**
     * Deliver the channels of one alert concurrently. Result order is kept.
     */
    private boolean parallelDelivery = false;

    @Data
    public static class Email {
        private String apiKey;
        private String from = "IntentVision Alerts <alerts@intentvision.io>";
        private String baseUrl = "https://api.resend.com";

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Data
    public static class Webhook {
        private Duration timeout = Duration.ofSeconds(10);
    }
}

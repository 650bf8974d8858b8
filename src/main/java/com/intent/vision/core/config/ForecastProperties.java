package com.intent.vision.core.config;

import com.intent.vision.core.enums.ForecastBackendType;
import com.intent.vision.core.enums.ForecastMethod;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Tuning knobs of the statistical engine, the forecast pipeline and the
 * remote paid backends.
 */
@Data
@Component
@ConfigurationProperties(prefix = "intentvision.forecast")
public class ForecastProperties {

    private int smaWindow = 10;
    private double ewmaAlpha = 0.3;
    private int linearWindow = 6;
    private ForecastMethod defaultMethod = ForecastMethod.EWMA;
    private double defaultConfidenceLevel = 0.95;

    /**
     * Clamp predictions and lower bounds at zero, for metrics that cannot go negative.
     */
    private boolean clampNonNegative = false;

    /**
     * Points fetched from the metric store when the caller gives no limit.
     */
    private int historyLimit = 365;

    /**
     * Reserve metered quota atomically before calling a paid backend instead of
     * counting after a successful call.
     */
    private boolean strictQuotaReservation = false;

    private Duration usageRetention = Duration.ofDays(90);

    /**
     * Keyed by backend code: "nixtla", "llm".
     */
    private Map<String, Remote> remote = new HashMap<>();

    public Remote remoteFor(ForecastBackendType backend) {
        return remote.get(backend.code());
    }

    @Data
    public static class Remote {
        private String url;
        private String apiKey;
        private Duration timeout = Duration.ofSeconds(30);

        public boolean isConfigured() {
            return url != null && !url.isBlank();
        }
    }
}

package com.intent.vision.core.config;

import com.intent.vision.core.enums.ForecastBackendType;
import com.intent.vision.core.service.forecast.ForecastEngine;
import com.intent.vision.core.service.forecast.HttpRemoteForecastClient;
import com.intent.vision.core.service.forecast.RemoteForecastEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Registers one engine per paid backend. An engine whose URL is not set still
 * exists; its calls fail with a RemoteBackendException.
 */
@Configuration
@Slf4j
public class RemoteForecastConfig {

    @Bean
    public ForecastEngine nixtlaForecastEngine(ForecastProperties props, RestTemplateBuilder builder) {
        return remote(ForecastBackendType.NIXTLA, props, builder);
    }

    @Bean
    public ForecastEngine llmForecastEngine(ForecastProperties props, RestTemplateBuilder builder) {
        return remote(ForecastBackendType.LLM, props, builder);
    }

    private ForecastEngine remote(ForecastBackendType backend, ForecastProperties props, RestTemplateBuilder builder) {
        ForecastProperties.Remote cfg = props.remoteFor(backend);
        Duration timeout = cfg != null ? cfg.getTimeout() : Duration.ofSeconds(30);
        RestTemplate template = builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
        HttpRemoteForecastClient client = new HttpRemoteForecastClient(backend, cfg, template);
        if (!client.isConfigured()) {
            log.warn("{} forecast backend has no URL configured; calls will fail", backend.code());
        }
        return new RemoteForecastEngine(client, props);
    }
}

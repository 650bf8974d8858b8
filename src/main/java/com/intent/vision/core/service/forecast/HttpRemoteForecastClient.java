package com.intent.vision.core.service.forecast;

import com.fasterxml.jackson.databind.JsonNode;
import com.intent.vision.core.common.exception.RemoteBackendException;
import com.intent.vision.core.config.ForecastProperties;
import com.intent.vision.core.dto.ForecastPrediction;
import com.intent.vision.core.dto.TimeSeriesPoint;
import com.intent.vision.core.enums.ForecastBackendType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON-over-HTTP client for a paid forecasting API (TimeGPT, LLM forecaster).
 * Posts the history to {@code {url}/forecast} and reads back a
 * {@code predictions[]} array of {@code timestamp, value, lower, upper}.
 */
@Slf4j
public class HttpRemoteForecastClient implements RemoteForecastClient {

    private final ForecastBackendType backend;
    private final ForecastProperties.Remote config;
    private final RestTemplate restTemplate;

    public HttpRemoteForecastClient(ForecastBackendType backend, ForecastProperties.Remote config,
                                    RestTemplate restTemplate) {
        this.backend = backend;
        this.config = config;
        this.restTemplate = restTemplate;
    }

    @Override
    public ForecastBackendType backend() {
        return backend;
    }

    @Override
    public boolean isConfigured() {
        return config != null && config.isConfigured();
    }

    @Override
    public List<ForecastPrediction> callBackend(List<TimeSeriesPoint> points, int horizonDays, double confidenceLevel) {
        if (!isConfigured()) {
            throw new RemoteBackendException(backend, backend.code() + " backend is not configured");
        }

        List<Map<String, Object>> series = new ArrayList<>(points.size());
        for (TimeSeriesPoint p : points) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("timestamp", p.timestamp().toString());
            row.put("value", p.value());
            series.add(row);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("series", series);
        body.put("horizon", horizonDays);
        body.put("frequency", "D");
        body.put("level", List.of(Math.round(confidenceLevel * 100)));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            headers.setBearerAuth(config.getApiKey());
        }

        final JsonNode response;
        try {
            response = restTemplate.postForObject(config.getUrl() + "/forecast", new HttpEntity<>(body, headers), JsonNode.class);
        } catch (RestClientException e) {
            log.warn("{} backend call failed: {}", backend.code(), e.getMessage());
            throw new RemoteBackendException(backend, backend.code() + " backend call failed: " + e.getMessage(), e);
        }

        if (response == null || !response.path("predictions").isArray()) {
            throw new RemoteBackendException(backend, backend.code() + " backend returned no predictions");
        }

        List<ForecastPrediction> out = new ArrayList<>();
        for (JsonNode n : response.path("predictions")) {
            try {
                Instant ts = n.hasNonNull("timestamp") ? Instant.parse(n.get("timestamp").asText()) : null;
                double value = n.path("value").asDouble(Double.NaN);
                out.add(new ForecastPrediction(ts, value,
                        n.path("lower").asDouble(value), n.path("upper").asDouble(value)));
            } catch (RuntimeException e) {
                throw new RemoteBackendException(backend, backend.code() + " backend returned a malformed prediction", e);
            }
        }
        return out;
    }
}

package com.intent.vision.core.test.service;

import com.intent.vision.core.common.exception.RemoteBackendException;
import com.intent.vision.core.config.ForecastProperties;
import com.intent.vision.core.dto.ForecastPrediction;
import com.intent.vision.core.dto.TimeSeriesPoint;
import com.intent.vision.core.enums.ForecastBackendType;
import com.intent.vision.core.service.forecast.HttpRemoteForecastClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpRemoteForecastClientTest {

    private static final List<TimeSeriesPoint> POINTS = List.of(
            new TimeSeriesPoint(Instant.parse("2026-01-01T00:00:00Z"), 10),
            new TimeSeriesPoint(Instant.parse("2026-01-02T00:00:00Z"), 11));

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private ForecastProperties.Remote config;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        config = new ForecastProperties.Remote();
        config.setUrl("https://forecast.example.com");
        config.setApiKey("k-1");
    }

    @Test
    void postsSeriesAndParsesPredictions() {
        HttpRemoteForecastClient client = new HttpRemoteForecastClient(ForecastBackendType.NIXTLA, config, restTemplate);
        server.expect(requestTo("https://forecast.example.com/forecast"))
                .andExpect(header("Authorization", "Bearer k-1"))
                .andExpect(jsonPath("$.horizon").value(1))
                .andExpect(jsonPath("$.series.length()").value(2))
                .andRespond(withSuccess("{\"predictions\":[{\"timestamp\":\"2026-01-03T00:00:00Z\","
                        + "\"value\":12.5,\"lower\":11.0,\"upper\":14.0}]}", MediaType.APPLICATION_JSON));

        List<ForecastPrediction> out = client.callBackend(POINTS, 1, 0.95);

        assertThat(out).containsExactly(new ForecastPrediction(Instant.parse("2026-01-03T00:00:00Z"), 12.5, 11.0, 14.0));
        server.verify();
    }

    @Test
    void httpErrorBecomesBackendError() {
        HttpRemoteForecastClient client = new HttpRemoteForecastClient(ForecastBackendType.LLM, config, restTemplate);
        server.expect(requestTo("https://forecast.example.com/forecast")).andRespond(withServerError());

        assertThatThrownBy(() -> client.callBackend(POINTS, 1, 0.95))
                .isInstanceOf(RemoteBackendException.class)
                .hasMessageStartingWith("llm backend call failed");
    }

    @Test
    void missingUrlIsNotConfigured() {
        HttpRemoteForecastClient client = new HttpRemoteForecastClient(ForecastBackendType.NIXTLA, null, restTemplate);

        assertThat(client.isConfigured()).isFalse();
        assertThatThrownBy(() -> client.callBackend(POINTS, 1, 0.95))
                .isInstanceOf(RemoteBackendException.class)
                .hasMessage("nixtla backend is not configured");
    }
}

package com.intent.vision.core.test.service;

import com.intent.vision.core.bus.EventBusConfig;
import com.intent.vision.core.bus.EventPublisher;
import com.intent.vision.core.common.Result;
import com.intent.vision.core.common.exception.RemoteBackendException;
import com.intent.vision.core.config.ForecastProperties;
import com.intent.vision.core.core.InMemoryFastStateStore;
import com.intent.vision.core.dto.BackendSelectionResult;
import com.intent.vision.core.dto.Forecast;
import com.intent.vision.core.dto.ForecastOptions;
import com.intent.vision.core.dto.ForecastRequest;
import com.intent.vision.core.dto.ForecastRun;
import com.intent.vision.core.dto.TimeSeriesPoint;
import com.intent.vision.core.enums.ForecastBackendType;
import com.intent.vision.core.enums.ForecastMethod;
import com.intent.vision.core.enums.PlanId;
import com.intent.vision.core.service.backend.BackendSelector;
import com.intent.vision.core.service.backend.CostEstimator;
import com.intent.vision.core.service.backend.StaticBackendPolicyProvider;
import com.intent.vision.core.service.backend.UsageTracker;
import com.intent.vision.core.service.forecast.ForecastEngines;
import com.intent.vision.core.service.forecast.ForecastService;
import com.intent.vision.core.service.forecast.RemoteForecastEngine;
import com.intent.vision.core.service.forecast.StatisticalForecastEngine;
import com.intent.vision.core.service.store.ForecastStore;
import com.intent.vision.core.service.store.MetricPointSource;
import com.intent.vision.core.test.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static com.intent.vision.core.enums.ForecastBackendType.NIXTLA;
import static com.intent.vision.core.enums.ForecastBackendType.STATISTICAL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ForecastServiceTest {

    private static final String ORG = "org-1";
    private static final Instant T0 = Instant.parse("2026-03-01T00:00:00Z");

    private MutableClock clock;
    private ForecastProperties props;
    private UsageTracker usage;
    private BackendSelector selector;
    private FakeRemoteClient nixtla;
    private MetricPointSource metricPoints;
    private ForecastStore forecastStore;
    private EventPublisher events;
    private ForecastService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0.plus(Duration.ofDays(30)));
        props = new ForecastProperties();
        usage = new UsageTracker(new InMemoryFastStateStore("t:", clock), props, clock);
        StaticBackendPolicyProvider policies = new StaticBackendPolicyProvider();
        selector = new BackendSelector(policies, usage, new CostEstimator());
        nixtla = new FakeRemoteClient(NIXTLA);
        ForecastEngines engines = new ForecastEngines(List.of(
                new StatisticalForecastEngine(props), new RemoteForecastEngine(nixtla, props)));
        metricPoints = mock(MetricPointSource.class);
        forecastStore = mock(ForecastStore.class);
        events = mock(EventPublisher.class);
        service = new ForecastService(engines, selector, policies, usage, metricPoints, forecastStore, events, props);
    }

    private static List<TimeSeriesPoint> points(int n) {
        List<TimeSeriesPoint> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(new TimeSeriesPoint(T0.plus(Duration.ofDays(i)), 100 + i));
        }
        return out;
    }

    private static ForecastOptions.ForecastOptionsBuilder options(ForecastBackendType backend) {
        return ForecastOptions.builder().requestedBackend(backend).horizonDays(7).method(ForecastMethod.SMA);
    }

    @Test
    void paidForecastIsCountedPersistedAndAnnounced() {
        when(metricPoints.getRecentPoints(ORG, "revenue", 365)).thenReturn(points(20));
        when(forecastStore.saveForecast(eq(ORG), eq("revenue"), any())).thenReturn("fc-1");

        Result<ForecastRun> r = service.forecastMetric(ORG, PlanId.STARTER, "revenue", options(NIXTLA).build());

        assertThat(r.isOk()).isTrue();
        assertThat(r.get().forecastId()).isEqualTo("fc-1");
        assertThat(r.get().forecast().backend()).isEqualTo(NIXTLA);
        assertThat(r.get().forecast().predictions()).hasSize(7);
        assertThat(r.get().selection().getSelectedBackend()).isEqualTo(NIXTLA);
        assertThat(usage.getUsage(ORG, NIXTLA)).isEqualTo(1);
        verify(events).publish(eq(EventBusConfig.TOPIC_BACKEND_USAGE), eq(ORG), any());
        verify(events).publish(eq(EventBusConfig.TOPIC_FORECAST_COMPLETED), eq(ORG), any());
    }

    @Test
    void statisticalForecastUsesNoQuota() {
        when(metricPoints.getRecentPoints(ORG, "revenue", 30)).thenReturn(points(20));
        when(forecastStore.saveForecast(anyString(), anyString(), any())).thenReturn("fc-2");

        Result<ForecastRun> r = service.forecastMetric(ORG, PlanId.FREE, "revenue",
                options(null).historyLimit(30).metricName("Revenue (USD)").build());

        assertThat(r.isOk()).isTrue();
        assertThat(r.get().forecast().backend()).isEqualTo(STATISTICAL);
        assertThat(usage.getRecentUsage(ORG, 1)).allSatisfy(c -> assertThat(c.count()).isZero());
        verify(forecastStore).saveForecast(eq(ORG), eq("Revenue (USD)"), any());
        verify(events, never()).publish(eq(EventBusConfig.TOPIC_BACKEND_USAGE), anyString(), any());
    }

    @Test
    void remoteFailureIsReturnedAndNotCounted() {
        nixtla.failing = true;
        when(metricPoints.getRecentPoints(ORG, "revenue", 365)).thenReturn(points(20));

        Result<ForecastRun> r = service.forecastMetric(ORG, PlanId.STARTER, "revenue", options(NIXTLA).build());

        assertThat(r.isOk()).isFalse();
        assertThat(r.getErrorCode()).isEqualTo("ERR-BE-001");
        assertThat(usage.getUsage(ORG, NIXTLA)).isZero();
        verify(forecastStore, never()).saveForecast(anyString(), anyString(), any());
    }

    @Test
    void remoteFailureFallsBackOnlyWhenAsked() {
        nixtla.failing = true;
        when(metricPoints.getRecentPoints(ORG, "revenue", 365)).thenReturn(points(20));
        when(forecastStore.saveForecast(anyString(), anyString(), any())).thenReturn("fc-3");

        Result<ForecastRun> r = service.forecastMetric(ORG, PlanId.STARTER, "revenue",
                options(NIXTLA).fallbackToStatisticalOnError(true).build());

        assertThat(r.isOk()).isTrue();
        BackendSelectionResult selection = r.get().selection();
        assertThat(selection.getSelectedBackend()).isEqualTo(STATISTICAL);
        assertThat(selection.getFallbackFrom()).isEqualTo(NIXTLA);
        assertThat(selection.getWarning()).contains("503");
        assertThat(r.get().forecast().backend()).isEqualTo(STATISTICAL);
        assertThat(usage.getUsage(ORG, NIXTLA)).isZero();
    }

    @Test
    void tooFewPointsFails() {
        when(metricPoints.getRecentPoints(ORG, "revenue", 365)).thenReturn(points(1));

        Result<ForecastRun> r = service.forecastMetric(ORG, PlanId.STARTER, "revenue", options(null).build());

        assertThat(r.isFailure()).isTrue();
        assertThat(r.getErrorCode()).isEqualTo("ERR-FC-001");
    }

    @Test
    void horizonBeyondPlanFailsWithoutFallback() {
        when(metricPoints.getRecentPoints(ORG, "revenue", 365)).thenReturn(points(20));

        Result<ForecastRun> r = service.forecastMetric(ORG, PlanId.FREE, "revenue",
                options(null).horizonDays(60).fallbackToStatisticalOnError(true).build());

        assertThat(r.getErrorCode()).isEqualTo("ERR-PLAN-001");
        assertThat(nixtla.calls).isZero();
    }

    @Test
    void storeOutageIsAnInternalError() {
        when(metricPoints.getRecentPoints(anyString(), anyString(), anyInt()))
                .thenThrow(new IllegalStateException("mongo down"));

        Result<ForecastRun> r = service.forecastMetric(ORG, PlanId.STARTER, "revenue", options(null).build());

        assertThat(r.getErrorCode()).isEqualTo("INTERNAL_ERROR");
        assertThat(r.getError()).contains("mongo down");
    }

    @Test
    void strictModeReservesAndReleasesOnFailure() {
        props.setStrictQuotaReservation(true);
        ForecastRequest request = new ForecastRequest(points(10), 3, null, ForecastMethod.SMA);
        BackendSelectionResult selection = selector.select(ORG, PlanId.STARTER, NIXTLA, 10, 3);

        service.runForecast(ORG, PlanId.STARTER, request, selection);
        assertThat(usage.getUsage(ORG, NIXTLA)).isEqualTo(1);

        nixtla.failing = true;
        assertThatThrownBy(() -> service.runForecast(ORG, PlanId.STARTER, request, selection))
                .isInstanceOf(RemoteBackendException.class);
        assertThat(usage.getUsage(ORG, NIXTLA)).isEqualTo(1);
    }

    @Test
    void strictModeReleasesOnTheDayItReservedWhenFailingAfterMidnight() {
        props.setStrictQuotaReservation(true);
        clock.set(Instant.parse("2026-03-31T23:59:59Z"));
        ForecastRequest request = new ForecastRequest(points(10), 3, null, ForecastMethod.SMA);
        BackendSelectionResult selection = selector.select(ORG, PlanId.STARTER, NIXTLA, 10, 3);
        usage.incrementUsage(ORG, NIXTLA);
        nixtla.failing = true;
        nixtla.onCall = () -> clock.advance(Duration.ofSeconds(2));

        assertThatThrownBy(() -> service.runForecast(ORG, PlanId.STARTER, request, selection))
                .isInstanceOf(RemoteBackendException.class);

        assertThat(usage.getUsage(ORG, NIXTLA, LocalDate.of(2026, 3, 31))).isEqualTo(1);
        assertThat(usage.getUsage(ORG, NIXTLA, LocalDate.of(2026, 4, 1))).isZero();
    }

    @Test
    void strictModeRunsStatisticalWhenReservationIsLost() {
        props.setStrictQuotaReservation(true);
        ForecastRequest request = new ForecastRequest(points(10), 3, null, ForecastMethod.SMA);
        BackendSelectionResult selection = selector.select(ORG, PlanId.STARTER, NIXTLA, 10, 3);
        for (int i = 0; i < 10; i++) {
            usage.incrementUsage(ORG, NIXTLA);
        }

        Forecast f = service.runForecast(ORG, PlanId.STARTER, request, selection);

        assertThat(f.backend()).isEqualTo(STATISTICAL);
        assertThat(usage.getUsage(ORG, NIXTLA)).isEqualTo(10);
        assertThat(nixtla.calls).isZero();
    }

    @Test
    void quotaDowngradeStopsCallingPaidBackend() {
        when(metricPoints.getRecentPoints(ORG, "revenue", 365)).thenReturn(points(20));
        when(forecastStore.saveForecast(anyString(), anyString(), any())).thenReturn("fc");

        for (int i = 0; i < 11; i++) {
            service.forecastMetric(ORG, PlanId.STARTER, "revenue", options(NIXTLA).build());
        }

        assertThat(nixtla.calls).isEqualTo(10);
        assertThat(usage.getUsage(ORG, NIXTLA)).isEqualTo(10);
    }
}

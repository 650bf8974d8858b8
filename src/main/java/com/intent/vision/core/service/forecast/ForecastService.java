package com.intent.vision.core.service.forecast;

import com.intent.vision.core.bus.EventBusConfig;
import com.intent.vision.core.bus.EventPublisher;
import com.intent.vision.core.common.Result;
import com.intent.vision.core.common.exception.BaseForecastException;
import com.intent.vision.core.common.exception.InvalidParameterException;
import com.intent.vision.core.common.exception.RemoteBackendException;
import com.intent.vision.core.config.ForecastProperties;
import com.intent.vision.core.dto.BackendPolicy;
import com.intent.vision.core.dto.BackendSelectionResult;
import com.intent.vision.core.dto.CostEstimate;
import com.intent.vision.core.dto.Forecast;
import com.intent.vision.core.dto.ForecastOptions;
import com.intent.vision.core.dto.ForecastRequest;
import com.intent.vision.core.dto.ForecastRun;
import com.intent.vision.core.dto.TimeSeriesPoint;
import com.intent.vision.core.dto.UsageReservation;
import com.intent.vision.core.enums.ForecastBackendType;
import com.intent.vision.core.enums.PlanId;
import com.intent.vision.core.service.backend.BackendPolicyProvider;
import com.intent.vision.core.service.backend.BackendSelector;
import com.intent.vision.core.service.backend.UsageTracker;
import com.intent.vision.core.service.store.ForecastStore;
import com.intent.vision.core.service.store.MetricPointSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@Slf4j
public class ForecastService {

    private final ForecastEngines engines;
    private final BackendSelector selector;
    private final BackendPolicyProvider policies;
    private final UsageTracker usage;
    private final MetricPointSource metricPoints;
    private final ForecastStore forecastStore;
    private final EventPublisher events;
    private final ForecastProperties props;

    public ForecastService(ForecastEngines engines,
                           BackendSelector selector,
                           BackendPolicyProvider policies,
                           UsageTracker usage,
                           MetricPointSource metricPoints,
                           ForecastStore forecastStore,
                           EventPublisher events,
                           ForecastProperties props) {
        this.engines = engines;
        this.selector = selector;
        this.policies = policies;
        this.usage = usage;
        this.metricPoints = metricPoints;
        this.forecastStore = forecastStore;
        this.events = events;
        this.props = props;
    }

    /**
     * Runs one forecast on the backend chosen by {@code selection}.
     * <p>
     * A metered backend is counted only after it answered successfully. In strict
     * mode the call is reserved first and given back on failure; a lost
     * reservation race runs the statistical engine instead.
     *
     * @throws BaseForecastException on invalid input or remote failure; nothing is counted then
     */
    public Forecast runForecast(String orgId, PlanId planId, ForecastRequest request, BackendSelectionResult selection) {
        ForecastBackendType backend = selection.getSelectedBackend();
        BackendPolicy policy = policies.getBackendPolicy(planId);
        boolean metered = policy != null && policy.isMetered(backend);

        UsageReservation reservation = null;
        if (metered && props.isStrictQuotaReservation()) {
            Optional<UsageReservation> held = usage.tryAcquire(orgId, backend, policy.dailyLimit(backend));
            if (held.isEmpty()) {
                log.warn("quota taken by a concurrent request org={} backend={}; running statistical", orgId, backend.code());
                return engines.statistical().forecast(request);
            }
            reservation = held.get();
        }

        Forecast forecast;
        try {
            forecast = engines.resolve(backend).forecast(request);
        } catch (RuntimeException e) {
            if (reservation != null) {
                usage.release(reservation);
            }
            throw e;
        }

        if (metered && reservation == null) {
            usage.incrementUsage(orgId, backend);
        }
        if (backend.isPaid()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("orgId", orgId);
            payload.put("backend", backend.code());
            payload.put("day", usage.today().toString());
            payload.put("credits", selection.getCostEstimate() == null ? 0 : selection.getCostEstimate().credits());
            events.publish(EventBusConfig.TOPIC_BACKEND_USAGE, orgId, payload);
        }
        return forecast;
    }

    /**
     * Fetch, select, run, persist and announce a forecast for one metric.
     * Fatal errors come back as a failed result carrying the exception's error code.
     */
    public Result<ForecastRun> forecastMetric(String orgId, PlanId planId, String metricId, ForecastOptions options) {
        try {
            if (metricId == null || metricId.isBlank()) {
                throw new InvalidParameterException("metricId is required");
            }
            int limit = options.getHistoryLimit() != null ? options.getHistoryLimit() : props.getHistoryLimit();
            List<TimeSeriesPoint> points = metricPoints.getRecentPoints(orgId, metricId, limit);

            BackendSelectionResult selection = selector.select(orgId, planId, options.getRequestedBackend(),
                    points.size(), options.getHorizonDays());
            if (selection.getWarning() != null) {
                log.info("forecast org={} metric={} warning={}", orgId, metricId, selection.getWarning());
            }

            ForecastRequest request = new ForecastRequest(points, options.getHorizonDays(),
                    options.getConfidenceLevel(), options.getMethod());

            Forecast forecast;
            try {
                forecast = runForecast(orgId, planId, request, selection);
            } catch (RemoteBackendException e) {
                if (!options.isFallbackToStatisticalOnError()) {
                    throw e;
                }
                log.warn("{} failed for org={} metric={}, falling back to statistical: {}",
                        selection.getSelectedBackend().code(), orgId, metricId, e.getMessage());
                selection = downgraded(selection, e.getMessage(), "remote backend failed, fell back to statistical");
                forecast = runForecast(orgId, planId, request, selection);
            }
            if (forecast.backend() != selection.getSelectedBackend()) {
                selection = downgraded(selection, "quota reached during the request",
                        "quota exceeded, fell back to statistical");
            }

            String metricName = options.getMetricName() != null ? options.getMetricName() : metricId;
            String forecastId = forecastStore.saveForecast(orgId, metricName, forecast);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("forecastId", forecastId);
            payload.put("orgId", orgId);
            payload.put("metricName", metricName);
            payload.put("backend", forecast.backend().code());
            payload.put("horizonDays", options.getHorizonDays());
            payload.put("predictions", forecast.predictions().size());
            events.publish(EventBusConfig.TOPIC_FORECAST_COMPLETED, orgId, payload);

            log.info("forecast {} completed org={} metric={} backend={} points={} horizon={}", forecastId, orgId,
                    metricName, forecast.backend().code(), points.size(), options.getHorizonDays());
            return Result.ok(new ForecastRun(forecastId, forecast, selection));
        } catch (BaseForecastException e) {
            log.warn("forecast failed org={} metric={} code={} msg={}", orgId, metricId, e.getErrorCode(), e.getMessage());
            return Result.fail(e);
        } catch (Exception e) {
            log.error("forecast failed org={} metric={}", orgId, metricId, e);
            return Result.fail("INTERNAL_ERROR", "Forecast failed: " + e.getMessage());
        }
    }

    private static BackendSelectionResult downgraded(BackendSelectionResult selection, String reason, String rationale) {
        ForecastBackendType from = selection.getFallbackFrom() != null
                ? selection.getFallbackFrom() : selection.getSelectedBackend();
        return selection.toBuilder()
                .selectedBackend(ForecastBackendType.STATISTICAL)
                .fallbackFrom(from)
                .warning(reason)
                .rationale(rationale)
                .costEstimate(CostEstimate.FREE)
                .build();
    }
}

package com.intent.vision.core.service.forecast;

import com.intent.vision.core.common.exception.RemoteBackendException;
import com.intent.vision.core.config.ForecastProperties;
import com.intent.vision.core.dto.Forecast;
import com.intent.vision.core.dto.ForecastPrediction;
import com.intent.vision.core.dto.ForecastRequest;
import com.intent.vision.core.dto.ForecastRunMetrics;
import com.intent.vision.core.dto.ModelInfo;
import com.intent.vision.core.dto.TimeSeriesPoint;
import com.intent.vision.core.enums.ForecastBackendType;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adapts a paid remote API to the engine contract: same input validation and
 * output cadence as the local engine, plus a sanity check of what came back.
 * Remote models are not guaranteed to be deterministic.
 */
@Slf4j
public class RemoteForecastEngine implements ForecastEngine {

    private final RemoteForecastClient client;
    private final ForecastProperties props;

    public RemoteForecastEngine(RemoteForecastClient client, ForecastProperties props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public ForecastBackendType backend() {
        return client.backend();
    }

    @Override
    public Forecast forecast(ForecastRequest request) {
        final long startNanos = System.nanoTime();
        ForecastRequests.validate(request);
        final double level = request.confidenceLevel() != null
                ? request.confidenceLevel() : props.getDefaultConfidenceLevel();
        // rejects levels outside (0, 1) before any money is spent
        ZScores.forConfidence(level);

        final List<TimeSeriesPoint> points = ForecastRequests.sorted(request.points());
        final List<ForecastPrediction> raw;
        try {
            raw = client.callBackend(points, request.horizonDays(), level);
        } catch (RemoteBackendException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RemoteBackendException(backend(), backend().code() + " backend failed: " + e.getMessage(), e);
        }

        if (raw == null || raw.size() != request.horizonDays()) {
            throw new RemoteBackendException(backend(), String.format("%s backend returned %d predictions, expected %d",
                    backend().code(), raw == null ? 0 : raw.size(), request.horizonDays()));
        }

        final Instant last = points.get(points.size() - 1).timestamp();
        final List<ForecastPrediction> predictions = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            ForecastPrediction p = raw.get(i);
            if (!Double.isFinite(p.predictedValue())) {
                throw new RemoteBackendException(backend(), backend().code() + " backend returned a non-finite value");
            }
            Instant ts = p.timestamp() != null ? p.timestamp() : ForecastRequests.stepTimestamp(last, i + 1);
            double v = p.predictedValue();
            // a missing or non-finite bound collapses onto the value
            double lower = Double.isFinite(p.confidenceLower()) ? Math.min(p.confidenceLower(), v) : v;
            double upper = Double.isFinite(p.confidenceUpper()) ? Math.max(p.confidenceUpper(), v) : v;
            if (props.isClampNonNegative()) {
                v = Math.max(0.0, v);
                lower = Math.max(0.0, lower);
                upper = Math.max(upper, v);
            }
            predictions.add(new ForecastPrediction(ts, v, lower, upper));
        }

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("confidenceLevel", level);
        params.put("deterministic", false);
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000L;
        log.info("{} forecast completed: {} points in, {} predictions out in {} ms",
                backend().code(), points.size(), predictions.size(), durationMs);

        return new Forecast(predictions, new ModelInfo("Remote " + backend().code(), "remote", params),
                backend(), new ForecastRunMetrics(points.size(), predictions.size(), durationMs));
    }
}

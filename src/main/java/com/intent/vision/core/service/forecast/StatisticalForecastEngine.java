package com.intent.vision.core.service.forecast;

import com.intent.vision.core.config.ForecastProperties;
import com.intent.vision.core.dto.Forecast;
import com.intent.vision.core.dto.ForecastPrediction;
import com.intent.vision.core.dto.ForecastRequest;
import com.intent.vision.core.dto.ForecastRunMetrics;
import com.intent.vision.core.dto.ModelInfo;
import com.intent.vision.core.dto.TimeSeriesPoint;
import com.intent.vision.core.enums.ForecastBackendType;
import com.intent.vision.core.enums.ForecastMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntToDoubleFunction;

/**
 * Local, free forecasting backend (SMA, EWMA, linear trend).
 * <p>
 * All three methods are pure functions of their input: the same request always
 * yields the same predictions. No method uses randomness.
 * <p>
 * Band widths:
 * <ul>
 *   <li>SMA: {@code z * sd * sqrt(1 + step / window)}, sd = sample standard deviation of the window</li>
 *   <li>EWMA: {@code z * sd * sqrt(1 + 0.1 * step)}, sd = exponentially weighted deviation</li>
 *   <li>Linear: {@code z * residualStdError}, constant over the horizon (not widened with distance)</li>
 * </ul>
 */
@Service
@Slf4j
public class StatisticalForecastEngine implements ForecastEngine {

    static final String MODEL_VERSION = "1.0.0";

    private final ForecastProperties props;

    public StatisticalForecastEngine(ForecastProperties props) {
        this.props = props;
    }

    @Override
    public ForecastBackendType backend() {
        return ForecastBackendType.STATISTICAL;
    }

    @Override
    public Forecast forecast(ForecastRequest request) {
        final long startNanos = System.nanoTime();
        ForecastRequests.validate(request);

        final double level = request.confidenceLevel() != null
                ? request.confidenceLevel() : props.getDefaultConfidenceLevel();
        final ForecastMethod method = request.method() != null ? request.method() : props.getDefaultMethod();
        final double z = ZScores.forConfidence(level);

        final List<TimeSeriesPoint> points = ForecastRequests.sorted(request.points());
        final double[] values = points.stream().mapToDouble(TimeSeriesPoint::value).toArray();

        final Fit fit = switch (method) {
            case SMA -> simpleMovingAverage(values, z);
            case EWMA -> exponentialWeightedMA(values, z);
            case LINEAR -> linearTrend(values, z);
        };

        final Instant last = points.get(points.size() - 1).timestamp();
        final List<ForecastPrediction> predictions = new ArrayList<>(request.horizonDays());
        for (int step = 1; step <= request.horizonDays(); step++) {
            predictions.add(predictionAt(ForecastRequests.stepTimestamp(last, step),
                    fit.center().applyAsDouble(step), fit.margin().applyAsDouble(step)));
        }

        Map<String, Object> params = new LinkedHashMap<>(fit.params());
        params.put("confidenceLevel", level);
        params.put("zScore", z);

        long durationMs = (System.nanoTime() - startNanos) / 1_000_000L;
        log.debug("Statistical {} forecast: {} points in, {} predictions out", method, values.length, predictions.size());

        return new Forecast(
                predictions,
                new ModelInfo("Statistical " + method.name(), MODEL_VERSION, params),
                ForecastBackendType.STATISTICAL,
                new ForecastRunMetrics(values.length, predictions.size(), durationMs));
    }

    private ForecastPrediction predictionAt(Instant ts, double center, double margin) {
        double predicted = center;
        double lower = center - margin;
        double upper = center + margin;
        if (props.isClampNonNegative()) {
            predicted = Math.max(0.0, predicted);
            lower = Math.max(0.0, lower);
            upper = Math.max(upper, predicted);
        }
        return new ForecastPrediction(ts, predicted, lower, upper);
    }

    // ===================== methods =====================

    private Fit simpleMovingAverage(double[] values, double z) {
        final int window = Math.min(values.length, Math.max(2, props.getSmaWindow()));
        final int from = values.length - window;
        final double mean = mean(values, from, values.length);

        double ss = 0.0;
        for (int i = from; i < values.length; i++) {
            double d = values[i] - mean;
            ss += d * d;
        }
        final double sd = Math.sqrt(ss / (window - 1));

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("windowSize", window);
        params.put("sma", mean);
        params.put("stdDev", sd);
        return new Fit(step -> mean, step -> z * sd * Math.sqrt(1.0 + (double) step / window), params);
    }

    private Fit exponentialWeightedMA(double[] values, double z) {
        final double alpha = props.getEwmaAlpha();
        double s = values[0];
        for (int i = 1; i < values.length; i++) {
            // incremental form keeps a constant series exactly constant
            s += alpha * (values[i] - s);
        }
        final double smoothed = s;

        double weighted = 0.0;
        double weightSum = 0.0;
        for (int i = 0; i < values.length; i++) {
            double w = Math.pow(1.0 - alpha, values.length - 1 - i);
            double d = values[i] - smoothed;
            weighted += w * d * d;
            weightSum += w;
        }
        final double sd = weightSum > 0.0 ? Math.sqrt(weighted / weightSum) : 0.0;

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("alpha", alpha);
        params.put("ewma", smoothed);
        params.put("stdDev", sd);
        return new Fit(step -> smoothed, step -> z * sd * Math.sqrt(1.0 + 0.1 * step), params);
    }

    private Fit linearTrend(double[] values, double z) {
        final int window = Math.min(values.length, Math.max(2, props.getLinearWindow()));
        final int from = values.length - window;
        final double xMean = (window - 1) / 2.0;
        final double yMean = mean(values, from, values.length);

        double num = 0.0;
        double den = 0.0;
        for (int i = 0; i < window; i++) {
            double dx = i - xMean;
            num += dx * (values[from + i] - yMean);
            den += dx * dx;
        }
        final double slope = den != 0.0 ? num / den : 0.0;
        final double intercept = yMean - slope * xMean;

        double sse = 0.0;
        double tss = 0.0;
        for (int i = 0; i < window; i++) {
            double y = values[from + i];
            double r = y - (intercept + slope * i);
            sse += r * r;
            tss += (y - yMean) * (y - yMean);
        }
        // two points always fit exactly; no residual degrees of freedom
        final double stdError = window > 2 ? Math.sqrt(sse / (window - 2)) : 0.0;
        final double margin = z * stdError;

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("windowSize", window);
        params.put("slope", slope);
        params.put("intercept", intercept);
        params.put("stdError", stdError);
        params.put("r2", tss > 0.0 ? 1.0 - sse / tss : 1.0);
        return new Fit(step -> intercept + slope * (window - 1 + step), step -> margin, params);
    }

    /**
     * Mean of {@code xs[from, to)}; returns the shared value exactly when the slice is constant.
     */
    private static double mean(double[] xs, int from, int to) {
        double first = xs[from];
        boolean constant = true;
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += xs[i];
            constant &= xs[i] == first;
        }
        return constant ? first : sum / (to - from);
    }

    private record Fit(IntToDoubleFunction center, IntToDoubleFunction margin, Map<String, Object> params) {
    }
}

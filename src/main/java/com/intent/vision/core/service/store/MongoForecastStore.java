package com.intent.vision.core.service.store;

import com.intent.vision.core.dto.Forecast;
import com.intent.vision.core.dto.ForecastPrediction;
import com.intent.vision.core.dto.ForecastRunMetrics;
import com.intent.vision.core.dto.ModelInfo;
import com.intent.vision.core.enums.ForecastBackendType;
import com.intent.vision.core.model.documents.ForecastDoc;
import com.intent.vision.core.repo.documents.ForecastRepo;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

@Component
public class MongoForecastStore implements ForecastStore {

    private final ForecastRepo repo;
    private final Clock clock;

    public MongoForecastStore(ForecastRepo repo, Clock clock) {
        this.repo = repo;
        this.clock = clock;
    }

    @Override
    public String saveForecast(String orgId, String metricName, Forecast forecast) {
        List<ForecastDoc.Prediction> predictions = forecast.predictions().stream()
                .map(p -> new ForecastDoc.Prediction(p.timestamp(), p.predictedValue(), p.confidenceLower(), p.confidenceUpper()))
                .toList();
        ForecastDoc.ForecastDocBuilder doc = ForecastDoc.builder()
                .orgId(orgId)
                .metricName(metricName)
                .status(ForecastDoc.STATUS_COMPLETED)
                .createdAt(clock.instant())
                .backend(forecast.backend().code())
                .predictions(predictions);
        if (forecast.modelInfo() != null) {
            doc.modelName(forecast.modelInfo().name())
                    .modelVersion(forecast.modelInfo().version())
                    .modelParameters(forecast.modelInfo().parameters());
        }
        if (forecast.metrics() != null) {
            doc.inputPoints(forecast.metrics().inputPoints())
                    .outputPoints(forecast.metrics().outputPoints())
                    .durationMs(forecast.metrics().durationMs());
        }
        return repo.save(doc.build()).getId();
    }

    @Override
    public Optional<Forecast> getLatestForecast(String orgId, String metricName) {
        return repo.findTopByOrgIdAndMetricNameAndStatusOrderByCreatedAtDesc(orgId, metricName, ForecastDoc.STATUS_COMPLETED)
                .map(MongoForecastStore::toForecast);
    }

    private static Forecast toForecast(ForecastDoc doc) {
        List<ForecastPrediction> predictions = doc.getPredictions() == null ? List.of() : doc.getPredictions().stream()
                .map(p -> new ForecastPrediction(p.getTimestamp(), p.getPredictedValue(), p.getConfidenceLower(), p.getConfidenceUpper()))
                .toList();
        return new Forecast(predictions,
                new ModelInfo(doc.getModelName(), doc.getModelVersion(), doc.getModelParameters()),
                ForecastBackendType.fromCode(doc.getBackend()),
                new ForecastRunMetrics(doc.getInputPoints(), doc.getOutputPoints(), doc.getDurationMs()));
    }
}

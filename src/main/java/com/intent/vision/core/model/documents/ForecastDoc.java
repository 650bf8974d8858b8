package com.intent.vision.core.model.documents;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Document("forecasts")
@CompoundIndex(name = "org_metric_created_idx", def = "{'orgId': 1, 'metricName': 1, 'createdAt': -1}")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForecastDoc {

    public static final String STATUS_COMPLETED = "completed";

    @Id
    private String id;

    private String orgId;

    private String metricName;

    private String status;

    private Instant createdAt;

    private String backend;

    private String modelName;

    private String modelVersion;

    private Map<String, Object> modelParameters;

    private List<Prediction> predictions;

    private int inputPoints;

    private int outputPoints;

    private long durationMs;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Prediction {
        private Instant timestamp;
        private double predictedValue;
        private double confidenceLower;
        private double confidenceUpper;
    }
}

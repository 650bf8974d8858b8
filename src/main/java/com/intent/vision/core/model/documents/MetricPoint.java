package com.intent.vision.core.model.documents;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One ingested observation of an organization's metric.
 */
@Document("metric_points")
@CompoundIndex(name = "org_metric_ts_idx", def = "{'orgId': 1, 'metricId': 1, 'timestamp': -1}")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricPoint {

    @Id
    private String id;

    private String orgId;

    private String metricId;

    private Instant timestamp;

    private double value;
}

package com.intent.vision.core.service.store;

import com.intent.vision.core.dto.TimeSeriesPoint;

import java.util.List;

public interface MetricPointSource {

    /**
     * The most recent {@code limit} points of a metric, ascending by timestamp.
     */
    List<TimeSeriesPoint> getRecentPoints(String orgId, String metricId, int limit);
}

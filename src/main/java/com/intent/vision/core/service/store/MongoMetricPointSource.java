package com.intent.vision.core.service.store;

import com.intent.vision.core.common.exception.InvalidParameterException;
import com.intent.vision.core.dto.TimeSeriesPoint;
import com.intent.vision.core.model.documents.MetricPoint;
import com.intent.vision.core.repo.documents.MetricPointRepo;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Component
public class MongoMetricPointSource implements MetricPointSource {

    private final MetricPointRepo repo;

    public MongoMetricPointSource(MetricPointRepo repo) {
        this.repo = repo;
    }

    @Override
    public List<TimeSeriesPoint> getRecentPoints(String orgId, String metricId, int limit) {
        if (limit <= 0) {
            throw new InvalidParameterException("History limit must be positive");
        }
        List<MetricPoint> newestFirst = repo.findByOrgIdAndMetricIdOrderByTimestampDesc(orgId, metricId, PageRequest.of(0, limit));
        List<TimeSeriesPoint> out = new ArrayList<>(newestFirst.size());
        for (MetricPoint p : newestFirst) {
            if (p.getTimestamp() != null) {
                out.add(new TimeSeriesPoint(p.getTimestamp(), p.getValue()));
            }
        }
        Collections.reverse(out);
        return out;
    }
}

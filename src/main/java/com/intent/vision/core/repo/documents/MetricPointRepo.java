package com.intent.vision.core.repo.documents;

import com.intent.vision.core.model.documents.MetricPoint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MetricPointRepo extends MongoRepository<MetricPoint, String> {

    /**
     * Newest points first; the page size is the history limit.
     */
    List<MetricPoint> findByOrgIdAndMetricIdOrderByTimestampDesc(String orgId, String metricId, Pageable page);
}

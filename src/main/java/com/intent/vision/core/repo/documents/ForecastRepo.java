package com.intent.vision.core.repo.documents;

import com.intent.vision.core.model.documents.ForecastDoc;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ForecastRepo extends MongoRepository<ForecastDoc, String> {

    Optional<ForecastDoc> findTopByOrgIdAndMetricNameAndStatusOrderByCreatedAtDesc(String orgId, String metricName, String status);
}

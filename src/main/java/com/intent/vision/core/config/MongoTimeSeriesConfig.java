package com.intent.vision.core.config;

import com.mongodb.client.MongoDatabase;
import lombok.Data;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Set;

/**
 * Creates {@code metric_points} as a MongoDB time-series collection
 * (timeField "timestamp", metaField "orgId") with retention, plus the
 * {orgId, metricId, timestamp} index used by the recent-points query.
 * <p>
 * Must run against an empty database: once Spring Data has created the
 * collection as a regular one it is left alone.
 * <p>
 * Toggle with:
 * intentvision.mongo.timeseries.enabled=true
 * intentvision.mongo.timeseries.init=true
 */
@Configuration
@ConditionalOnProperty(prefix = "intentvision.mongo.timeseries", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MongoTimeSeriesConfig {

    private static final Logger log = LoggerFactory.getLogger(MongoTimeSeriesConfig.class);

    @Bean
    @ConfigurationProperties(prefix = "intentvision.mongo.timeseries")
    public MetricTsProps metricTsProps() {
        return new MetricTsProps();
    }

    @Bean
    public ApplicationRunner metricPointsBootstrap(MongoTemplate mongoTemplate, MetricTsProps p) {
        return args -> {
            if (!p.isInit()) {
                log.info("Mongo time-series bootstrap disabled (intentvision.mongo.timeseries.init=false). Skipping.");
                return;
            }

            MongoDatabase db = mongoTemplate.getDb();
            Set<String> existing = new HashSet<>();
            db.listCollectionNames().into(new ArrayList<>()).forEach(existing::add);

            ensureTimeSeriesCollection(db, mongoTemplate, existing, p);
            log.info("Mongo time-series bootstrap complete.");
        };
    }

    private void ensureTimeSeriesCollection(MongoDatabase db, MongoTemplate template, Set<String> existing, MetricTsProps p) {
        String collection = p.getCollection();
        if (!existing.contains(collection)) {
            Document cmd = new Document("create", collection)
                    .append("timeseries", new Document("timeField", "timestamp")
                            .append("metaField", "orgId")
                            .append("granularity", p.getGranularity()))
                    .append("expireAfterSeconds", p.getExpireAfterSeconds());
            try {
                log.info("Creating time-series collection '{}' (granularity='{}', expireAfterSeconds={})",
                        collection, p.getGranularity(), p.getExpireAfterSeconds());
                db.runCommand(cmd);
            } catch (RuntimeException e) {
                log.warn("Failed to create time-series collection '{}': {}", collection, e.getMessage());
            }
        } else {
            log.info("Collection '{}' already exists, skipping create.", collection);
        }

        try {
            Document keys = new Document("orgId", 1).append("metricId", 1).append("timestamp", 1);
            boolean exists = template.getCollection(collection)
                    .listIndexes()
                    .into(new ArrayList<>())
                    .stream()
                    .anyMatch(ix -> keys.toJson().equals(ix.get("key", Document.class).toJson()));
            if (!exists) {
                log.info("Creating compound index on '{}': {}", collection, keys.toJson());
                template.getCollection(collection).createIndex(keys);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to ensure index on '{}': {}", collection, e.getMessage());
        }
    }

    @Data
    public static class MetricTsProps {
        /**
         * Run bootstrap at startup
         */
        private boolean init = false;

        private String collection = "metric_points";

        /**
         * "seconds" | "minutes" | "hours"
         */
        private String granularity = "hours";

        private long expireAfterSeconds = 730L * 24 * 60 * 60;
    }
}

package com.intent.vision.core.model.documents;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

@Document("alert_events")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertEventDoc {

    @Id
    private String id;

    @Indexed
    private String orgId;

    @Indexed
    private String ruleId;

    private String metricName;

    private Instant triggeredAt;

    private double triggerValue;

    private String operator;

    private double threshold;

    private List<ChannelResult> channelResults;

    private String overallStatus;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChannelResult {
        private String channelType;
        private String status;
        private String externalId;
        private String error;
        private List<String> recipients;
    }
}

package com.intent.vision.core.service.notification;

import com.intent.vision.core.dto.AlertContent;
import com.intent.vision.core.dto.SendOutcome;
import com.intent.vision.core.enums.ChannelType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * POSTs the alert as JSON to every recipient URL. The channel counts as sent
 * only when every URL accepted the payload.
 */
@Component
@Slf4j
public class WebhookNotificationSender implements NotificationSender {

    private final RestTemplate restTemplate;

    public WebhookNotificationSender(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public ChannelType channelType() {
        return ChannelType.WEBHOOK;
    }

    @Override
    public boolean isConfigured() {
        return true;
    }

    @Override
    public SendOutcome send(List<String> recipients, AlertContent content) {
        Map<String, Object> condition = new LinkedHashMap<>();
        condition.put("operator", content.condition().operator().code());
        condition.put("value", content.condition().value());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "forecast_alert");
        payload.put("subject", content.subject());
        payload.put("metricName", content.metricName());
        payload.put("triggerValue", content.triggerValue());
        payload.put("condition", condition);
        payload.put("horizonDays", content.horizonDays());
        payload.put("text", content.textBody());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Map<String, Object>> entity = new HttpEntity<>(payload, headers);

        List<String> errors = new ArrayList<>();
        for (String url : recipients) {
            try {
                restTemplate.postForEntity(url, entity, String.class);
            } catch (RestClientException e) {
                log.warn("webhook delivery failed url={} cause={}", url, e.getMessage());
                errors.add(url + ": " + e.getMessage());
            }
        }
        if (!errors.isEmpty()) {
            return SendOutcome.failed("Webhook delivery failed for " + String.join("; ", errors));
        }
        return SendOutcome.sent(null);
    }
}

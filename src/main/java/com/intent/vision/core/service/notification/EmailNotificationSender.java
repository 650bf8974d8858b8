package com.intent.vision.core.service.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.intent.vision.core.config.NotificationProperties;
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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Email through the Resend HTTP API. One request carries all recipients.
 */
@Component
@Slf4j
public class EmailNotificationSender implements NotificationSender {

    private final NotificationProperties props;
    private final RestTemplate restTemplate;

    public EmailNotificationSender(NotificationProperties props, RestTemplate restTemplate) {
        this.props = props;
        this.restTemplate = restTemplate;
    }

    @Override
    public ChannelType channelType() {
        return ChannelType.EMAIL;
    }

    @Override
    public boolean isConfigured() {
        return props.getEmail().isConfigured();
    }

    @Override
    public SendOutcome send(List<String> recipients, AlertContent content) {
        NotificationProperties.Email cfg = props.getEmail();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("from", cfg.getFrom());
        body.put("to", recipients);
        body.put("subject", content.subject());
        body.put("html", content.htmlBody());
        body.put("text", content.textBody());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(cfg.getApiKey());

        try {
            JsonNode response = restTemplate.postForObject(cfg.getBaseUrl() + "/emails", new HttpEntity<>(body, headers), JsonNode.class);
            String id = response == null ? null : response.path("id").asText(null);
            log.info("alert email sent id={} recipients={}", id, recipients.size());
            return SendOutcome.sent(id);
        } catch (RestClientException e) {
            log.warn("alert email failed: {}", e.getMessage());
            return SendOutcome.failed("Email delivery failed: " + e.getMessage());
        }
    }
}

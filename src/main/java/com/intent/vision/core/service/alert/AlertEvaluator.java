package com.intent.vision.core.service.alert;

import com.intent.vision.core.bus.EventBusConfig;
import com.intent.vision.core.bus.EventPublisher;
import com.intent.vision.core.dto.AlertContent;
import com.intent.vision.core.dto.AlertEvent;
import com.intent.vision.core.dto.AlertRule;
import com.intent.vision.core.dto.DispatchOutcome;
import com.intent.vision.core.dto.EvaluationResult;
import com.intent.vision.core.dto.Forecast;
import com.intent.vision.core.dto.ForecastPrediction;
import com.intent.vision.core.enums.DeliveryStatus;
import com.intent.vision.core.enums.EvaluationOutcome;
import com.intent.vision.core.service.notification.NotificationDispatcher;
import com.intent.vision.core.service.store.AlertEventStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks rules against the latest forecasts, one rule at a time, in input order.
 * <p>
 * A rule fires on the earliest prediction inside {@code [now, now + horizonDays]}
 * that meets its condition; later and possibly more extreme predictions are not
 * looked at. Each rule yields exactly one result; an error in one rule is
 * recorded on that rule and the pass goes on.
 */
@Service
@Slf4j
public class AlertEvaluator {

    private final NotificationDispatcher dispatcher;
    private final AlertContentBuilder contentBuilder;
    private final AlertSuppressionPolicy suppression;
    private final AlertEventStore eventStore;
    private final EventPublisher events;
    private final Clock clock;

    public AlertEvaluator(NotificationDispatcher dispatcher,
                          AlertContentBuilder contentBuilder,
                          AlertSuppressionPolicy suppression,
                          AlertEventStore eventStore,
                          EventPublisher events,
                          Clock clock) {
        this.dispatcher = dispatcher;
        this.contentBuilder = contentBuilder;
        this.suppression = suppression;
        this.eventStore = eventStore;
        this.events = events;
        this.clock = clock;
    }

    public List<EvaluationResult> evaluate(String orgId, List<AlertRule> rules, ForecastLookup lookup) {
        List<EvaluationResult> results = new ArrayList<>(rules.size());
        for (AlertRule rule : rules) {
            results.add(evaluateRule(orgId, rule, lookup));
        }
        long fired = results.stream().filter(EvaluationResult::triggered).count();
        log.info("alert evaluation org={} rules={} triggered={}", orgId, rules.size(), fired);
        return results;
    }

    private EvaluationResult evaluateRule(String orgId, AlertRule rule, ForecastLookup lookup) {
        if (rule == null) {
            log.warn("alert evaluation org={} got a null rule", orgId);
            return new EvaluationResult(null, null, EvaluationOutcome.FAILED, null, null, "Alert rule is required");
        }
        try {
            if (!rule.isEnabled()) {
                return EvaluationResult.of(rule, EvaluationOutcome.DISABLED, "Rule is disabled");
            }
            Optional<Forecast> forecast = lookup.latestFor(rule.getMetricName());
            if (forecast.isEmpty() || forecast.get().predictions().isEmpty()) {
                return EvaluationResult.of(rule, EvaluationOutcome.NO_FORECAST,
                        "No completed forecast found for metric " + rule.getMetricName());
            }

            Instant now = clock.instant();
            Instant end = now.plus(rule.getHorizonDays(), ChronoUnit.DAYS);
            List<ForecastPrediction> inHorizon = forecast.get().predictions().stream()
                    .filter(p -> p.timestamp() != null && !p.timestamp().isBefore(now) && !p.timestamp().isAfter(end))
                    .sorted(Comparator.comparing(ForecastPrediction::timestamp))
                    .toList();
            if (inHorizon.isEmpty()) {
                return EvaluationResult.of(rule, EvaluationOutcome.NO_PREDICTIONS_IN_HORIZON,
                        "No predictions within horizon of " + rule.getHorizonDays() + " days");
            }

            Optional<ForecastPrediction> hit = inHorizon.stream()
                    .filter(p -> rule.getCondition().isMetBy(p.predictedValue()))
                    .findFirst();
            if (hit.isEmpty()) {
                return EvaluationResult.of(rule, EvaluationOutcome.NOT_TRIGGERED, null);
            }
            double triggerValue = hit.get().predictedValue();

            String ruleKey = rule.getId() != null ? rule.getId() : rule.getMetricName();
            if (!suppression.tryMarkFired(orgId, ruleKey)) {
                log.debug("alert suppressed org={} rule={} window={}", orgId, ruleKey, suppression.window());
                return new EvaluationResult(rule.getId(), rule.getMetricName(), EvaluationOutcome.SUPPRESSED,
                        triggerValue, null, "Already fired within " + suppression.window());
            }

            AlertContent content = contentBuilder.build(rule, triggerValue);
            DispatchOutcome outcome = dispatcher.dispatchAlert(rule.getChannels(), content);

            AlertEvent event = new AlertEvent(null, orgId, rule.getId(), rule.getMetricName(), now, triggerValue,
                    rule.getCondition(), outcome.channelResults(), outcome.overallStatus());
            String error = null;
            try {
                event = eventStore.save(event);
            } catch (RuntimeException e) {
                log.error("alert event not persisted org={} rule={}", orgId, rule.getId(), e);
                error = "Failed to persist alert event: " + e.getMessage();
            }

            if (outcome.overallStatus() == DeliveryStatus.SENT) {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("eventId", event.id());
                payload.put("orgId", orgId);
                payload.put("ruleId", rule.getId());
                payload.put("metricName", rule.getMetricName());
                payload.put("triggerValue", triggerValue);
                payload.put("operator", rule.getCondition().operator().code());
                payload.put("threshold", rule.getCondition().value());
                events.publish(EventBusConfig.TOPIC_ALERT_FIRED, orgId, payload);
            }
            log.info("alert triggered org={} rule={} metric={} value={} status={}", orgId, rule.getId(),
                    rule.getMetricName(), triggerValue, outcome.overallStatus());
            return EvaluationResult.triggered(rule, event, error);
        } catch (Exception e) {
            log.warn("alert evaluation failed org={} rule={}: {}", orgId, rule.getId(), e.toString());
            return EvaluationResult.of(rule, EvaluationOutcome.FAILED,
                    e.getMessage() != null ? e.getMessage() : e.toString());
        }
    }
}

package com.intent.vision.core.service.alert;

import com.intent.vision.core.common.exception.InvalidParameterException;
import com.intent.vision.core.dto.AlertEvent;
import com.intent.vision.core.dto.AlertRule;
import com.intent.vision.core.dto.AlertRuleInput;
import com.intent.vision.core.dto.EvaluationResult;
import com.intent.vision.core.dto.Forecast;
import com.intent.vision.core.enums.EvaluationOutcome;
import com.intent.vision.core.service.store.AlertEventStore;
import com.intent.vision.core.service.store.ForecastStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Organization-level entry point: pairs rules with the stored forecasts.
 */
@Service
@Slf4j
public class AlertService {

    private final AlertEvaluator evaluator;
    private final AlertRuleNormalizer normalizer;
    private final ForecastStore forecastStore;
    private final AlertEventStore eventStore;

    public AlertService(AlertEvaluator evaluator,
                        AlertRuleNormalizer normalizer,
                        ForecastStore forecastStore,
                        AlertEventStore eventStore) {
        this.evaluator = evaluator;
        this.normalizer = normalizer;
        this.forecastStore = forecastStore;
        this.eventStore = eventStore;
    }

    /**
     * @param metricFilter only rules on this metric are evaluated; null for all
     */
    public List<EvaluationResult> evaluateAlerts(String orgId, List<AlertRule> rules, String metricFilter) {
        List<AlertRule> selected = rules.stream()
                .filter(r -> r == null || metricFilter == null || metricFilter.equals(r.getMetricName()))
                .toList();

        // one store read per metric and pass
        Map<String, Optional<Forecast>> cache = new HashMap<>();
        ForecastLookup lookup = metric -> cache.computeIfAbsent(metric, m -> forecastStore.getLatestForecast(orgId, m));
        return evaluator.evaluate(orgId, selected, lookup);
    }

    /**
     * Same as {@link #evaluateAlerts} for rules in submitted form. A rule that does
     * not normalize gets a FAILED result in its place; the rest are evaluated.
     */
    public List<EvaluationResult> evaluateRuleInputs(String orgId, List<AlertRuleInput> inputs, String metricFilter) {
        List<AlertRule> rules = new ArrayList<>();
        List<EvaluationResult> slots = new ArrayList<>();
        for (AlertRuleInput input : inputs) {
            if (input != null && metricFilter != null && !metricFilter.equals(input.metricName())) {
                continue;
            }
            try {
                rules.add(normalizer.normalize(input));
                slots.add(null);
            } catch (InvalidParameterException e) {
                log.warn("alert rule rejected org={} rule={}: {}", orgId, input == null ? null : input.id(), e.getMessage());
                slots.add(new EvaluationResult(input == null ? null : input.id(),
                        input == null ? null : input.metricName(), EvaluationOutcome.FAILED, null, null, e.getMessage()));
            }
        }

        Iterator<EvaluationResult> evaluated = evaluateAlerts(orgId, rules, null).iterator();
        List<EvaluationResult> results = new ArrayList<>(slots.size());
        for (EvaluationResult slot : slots) {
            results.add(slot != null ? slot : evaluated.next());
        }
        return results;
    }

    public List<AlertEvent> getAlertHistory(String orgId, String ruleId) {
        return eventStore.findByRule(orgId, ruleId);
    }
}

package com.intent.vision.core.test.service;

import com.intent.vision.core.dto.AlertCondition;
import com.intent.vision.core.dto.AlertEvent;
import com.intent.vision.core.dto.AlertRule;
import com.intent.vision.core.dto.AlertRuleInput;
import com.intent.vision.core.dto.AlertRuleInput.ConditionInput;
import com.intent.vision.core.dto.EvaluationResult;
import com.intent.vision.core.dto.Forecast;
import com.intent.vision.core.enums.ConditionOperator;
import com.intent.vision.core.enums.EvaluationOutcome;
import com.intent.vision.core.enums.ForecastBackendType;
import com.intent.vision.core.service.alert.AlertEvaluator;
import com.intent.vision.core.service.alert.AlertRuleNormalizer;
import com.intent.vision.core.service.alert.AlertService;
import com.intent.vision.core.service.alert.ForecastLookup;
import com.intent.vision.core.service.store.AlertEventStore;
import com.intent.vision.core.service.store.ForecastStore;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AlertServiceTest {

    private ValidatorFactory factory;
    private AlertEvaluator evaluator;
    private ForecastStore forecastStore;
    private AlertEventStore eventStore;
    private AlertService service;

    @BeforeEach
    void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        evaluator = mock(AlertEvaluator.class);
        forecastStore = mock(ForecastStore.class);
        eventStore = mock(AlertEventStore.class);
        service = new AlertService(evaluator, new AlertRuleNormalizer(factory.getValidator()), forecastStore, eventStore);

        // answer NOT_TRIGGERED for every rule after touching its forecast
        when(evaluator.evaluate(eq("org-1"), anyList(), any(ForecastLookup.class))).thenAnswer(inv -> {
            List<AlertRule> rules = inv.getArgument(1);
            ForecastLookup lookup = inv.getArgument(2);
            return rules.stream().map(r -> {
                lookup.latestFor(r.getMetricName());
                return EvaluationResult.of(r, EvaluationOutcome.NOT_TRIGGERED, null);
            }).toList();
        });
    }

    @AfterEach
    void tearDown() {
        factory.close();
    }

    private static AlertRule rule(String id, String metric) {
        return AlertRule.builder().id(id).metricName(metric)
                .condition(new AlertCondition(ConditionOperator.GT, 1)).horizonDays(7).enabled(true).build();
    }

    @Test
    void forecastIsReadOncePerMetricAndPass() {
        when(forecastStore.getLatestForecast("org-1", "revenue")).thenReturn(
                Optional.of(new Forecast(List.of(), null, ForecastBackendType.STATISTICAL, null)));

        List<EvaluationResult> results = service.evaluateAlerts("org-1",
                List.of(rule("r1", "revenue"), rule("r2", "revenue"), rule("r3", "churn")), null);

        assertThat(results).extracting(EvaluationResult::ruleId).containsExactly("r1", "r2", "r3");
        verify(forecastStore, times(1)).getLatestForecast("org-1", "revenue");
        verify(forecastStore, times(1)).getLatestForecast("org-1", "churn");
    }

    @Test
    void metricFilterLimitsRules() {
        List<EvaluationResult> results = service.evaluateAlerts("org-1",
                List.of(rule("r1", "revenue"), rule("r2", "churn")), "churn");

        assertThat(results).extracting(EvaluationResult::ruleId).containsExactly("r2");
    }

    @Test
    void invalidSubmittedRuleFailsInItsOwnSlot() {
        AlertRuleInput ok1 = new AlertRuleInput("r1", "org-1", "revenue", new ConditionInput("gt", 5.0), null, null, 7, null, null, null);
        AlertRuleInput bad = new AlertRuleInput("r2", "org-1", "revenue", new ConditionInput("between", 5.0), null, null, 7, null, null, null);
        AlertRuleInput ok2 = new AlertRuleInput("r3", "org-1", "revenue", null, "below", 2.0, 7, null, null, null);

        List<EvaluationResult> results = service.evaluateRuleInputs("org-1", List.of(ok1, bad, ok2), null);

        assertThat(results).extracting(EvaluationResult::ruleId).containsExactly("r1", "r2", "r3");
        assertThat(results.get(1).outcome()).isEqualTo(EvaluationOutcome.FAILED);
        assertThat(results.get(1).error()).contains("condition.operator");
        assertThat(results.get(2).outcome()).isEqualTo(EvaluationOutcome.NOT_TRIGGERED);
    }

    @Test
    void historyComesFromEventStore() {
        AlertEvent event = new AlertEvent("e1", "org-1", "r1", "revenue", null, 5, null, null, null);
        when(eventStore.findByRule("org-1", "r1")).thenReturn(List.of(event));

        assertThat(service.getAlertHistory("org-1", "r1")).containsExactly(event);
    }
}

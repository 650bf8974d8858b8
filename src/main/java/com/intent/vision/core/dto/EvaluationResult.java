package com.intent.vision.core.dto;

import com.intent.vision.core.enums.EvaluationOutcome;

public record EvaluationResult(
        String ruleId,
        String metricName,
        EvaluationOutcome outcome,
        Double triggerValue,
        AlertEvent event,
        String error
) {
    public boolean triggered() {
        return outcome == EvaluationOutcome.TRIGGERED;
    }

    public static EvaluationResult of(AlertRule rule, EvaluationOutcome outcome, String error) {
        return new EvaluationResult(rule.getId(), rule.getMetricName(), outcome, null, null, error);
    }

    public static EvaluationResult triggered(AlertRule rule, AlertEvent event, String error) {
        return new EvaluationResult(rule.getId(), rule.getMetricName(), EvaluationOutcome.TRIGGERED,
                event.triggerValue(), event, error);
    }
}

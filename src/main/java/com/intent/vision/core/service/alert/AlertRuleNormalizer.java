package com.intent.vision.core.service.alert;

import com.intent.vision.core.common.exception.InvalidParameterException;
import com.intent.vision.core.dto.AlertCondition;
import com.intent.vision.core.dto.AlertRule;
import com.intent.vision.core.dto.AlertRuleInput;
import com.intent.vision.core.enums.ConditionOperator;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a submitted rule into its single internal shape. The explicit
 * {@code condition} wins over the legacy {@code direction + threshold} pair;
 * "above" becomes gt and "below" becomes lt.
 */
@Component
public class AlertRuleNormalizer {

    private final Validator validator;

    public AlertRuleNormalizer(Validator validator) {
        this.validator = validator;
    }

    public AlertRule normalize(AlertRuleInput input) {
        if (input == null) {
            throw new InvalidParameterException("Alert rule is required");
        }
        Set<ConstraintViolation<AlertRuleInput>> violations = validator.validate(input);
        if (!violations.isEmpty()) {
            throw new InvalidParameterException(violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; ")));
        }

        return AlertRule.builder()
                .id(input.id())
                .orgId(input.orgId())
                .metricName(input.metricName().trim())
                .condition(condition(input))
                .horizonDays(input.horizonDays())
                .channels(input.channels() == null ? List.of() : input.channels())
                .enabled(input.enabled() == null || input.enabled())
                .description(input.description())
                .build();
    }

    private static AlertCondition condition(AlertRuleInput input) {
        AlertRuleInput.ConditionInput c = input.condition();
        if (c != null) {
            if (c.value() == null || !Double.isFinite(c.value())) {
                throw new InvalidParameterException("condition.value must be a finite number");
            }
            return new AlertCondition(ConditionOperator.fromCode(c.operator()), c.value());
        }
        if (input.direction() != null || input.threshold() != null) {
            if (input.threshold() == null || !Double.isFinite(input.threshold())) {
                throw new InvalidParameterException("threshold must be a finite number");
            }
            return new AlertCondition(ConditionOperator.fromDirection(input.direction()), input.threshold());
        }
        throw new InvalidParameterException("Alert rule needs either a condition or a direction and threshold");
    }
}

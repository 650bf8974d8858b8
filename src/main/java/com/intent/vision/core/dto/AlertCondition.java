package com.intent.vision.core.dto;

import com.intent.vision.core.enums.ConditionOperator;

import java.util.Objects;

/**
 * Normalized trigger condition. Every rule is evaluated through this shape,
 * whatever form it was submitted in.
 */
public record AlertCondition(ConditionOperator operator, double value) {

    public AlertCondition {
        Objects.requireNonNull(operator, "operator");
    }

    public boolean isMetBy(double predictedValue) {
        return operator.test(predictedValue, value);
    }
}

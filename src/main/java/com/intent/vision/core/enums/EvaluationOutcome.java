package com.intent.vision.core.enums;

public enum EvaluationOutcome {
    TRIGGERED,
    NOT_TRIGGERED,
    DISABLED,
    NO_FORECAST,
    NO_PREDICTIONS_IN_HORIZON,
    SUPPRESSED,
    FAILED
}

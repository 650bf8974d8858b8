package com.intent.vision.core.enums;

import com.intent.vision.core.common.exception.InvalidParameterException;

import java.util.Locale;

public enum PlanId {
    FREE,
    STARTER,
    GROWTH,
    ENTERPRISE;

    public static PlanId fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new InvalidParameterException("Plan id is required");
        }
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidParameterException("Unknown plan: " + code, e);
        }
    }
}

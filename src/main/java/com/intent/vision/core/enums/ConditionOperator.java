package com.intent.vision.core.enums;

import com.intent.vision.core.common.exception.InvalidParameterException;

import java.util.Locale;

/**
 * Comparison applied to a predicted value. Legacy rules only know
 * "above" (GT) and "below" (LT).
 */
public enum ConditionOperator {
    GT {
        @Override
        public boolean test(double value, double threshold) {
            return value > threshold;
        }
    },
    GTE {
        @Override
        public boolean test(double value, double threshold) {
            return value >= threshold;
        }
    },
    LT {
        @Override
        public boolean test(double value, double threshold) {
            return value < threshold;
        }
    },
    LTE {
        @Override
        public boolean test(double value, double threshold) {
            return value <= threshold;
        }
    };

    public abstract boolean test(double value, double threshold);

    public boolean isUpward() {
        return this == GT || this == GTE;
    }

    /**
     * Legacy direction this operator corresponds to ("above" or "below").
     */
    public String direction() {
        return isUpward() ? "above" : "below";
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ConditionOperator fromCode(String code) {
        if (code != null) {
            for (ConditionOperator op : values()) {
                if (op.code().equalsIgnoreCase(code.trim())) {
                    return op;
                }
            }
        }
        throw new InvalidParameterException("condition.operator must be one of: gt, lt, gte, lte");
    }

    public static ConditionOperator fromDirection(String direction) {
        if ("above".equalsIgnoreCase(direction)) return GT;
        if ("below".equalsIgnoreCase(direction)) return LT;
        throw new InvalidParameterException("direction must be \"above\" or \"below\"");
    }
}

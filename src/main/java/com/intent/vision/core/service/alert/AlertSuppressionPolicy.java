package com.intent.vision.core.service.alert;

import com.intent.vision.core.config.AlertProperties;
import com.intent.vision.core.core.FastStateStore;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Re-fire window per organization and rule. With a zero window every
 * matching evaluation fires.
 */
@Component
public class AlertSuppressionPolicy {

    private final FastStateStore fast;
    private final AlertProperties props;

    public AlertSuppressionPolicy(FastStateStore fast, AlertProperties props) {
        this.fast = fast;
        this.props = props;
    }

    public Duration window() {
        Duration w = props.getRefireSuppressionWindow();
        return w == null || w.isNegative() ? Duration.ZERO : w;
    }

    /**
     * Claims the right to fire. False when the rule already fired inside the window.
     */
    public boolean tryMarkFired(String orgId, String ruleKey) {
        Duration w = window();
        if (w.isZero()) {
            return true;
        }
        return fast.setIfAbsent("alert:fired:" + orgId + ":" + ruleKey, "1", w);
    }
}

package com.intent.vision.core.test.service;

import com.intent.vision.core.config.AlertProperties;
import com.intent.vision.core.dto.AlertCondition;
import com.intent.vision.core.dto.AlertContent;
import com.intent.vision.core.dto.AlertRule;
import com.intent.vision.core.enums.ConditionOperator;
import com.intent.vision.core.service.alert.AlertContentBuilder;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AlertContentBuilderTest {

    private final AlertContentBuilder builder = new AlertContentBuilder(new AlertProperties());

    private static AlertRule rule(ConditionOperator op, String description) {
        return AlertRule.builder()
                .id("r1")
                .metricName("signups")
                .condition(new AlertCondition(op, 100))
                .horizonDays(14)
                .enabled(true)
                .description(description)
                .build();
    }

    @Test
    void upwardRuleSaysExceeded() {
        AlertContent c = builder.build(rule(ConditionOperator.GT, null), 105.456);

        assertThat(c.subject()).isEqualTo("Alert: signups forecast exceeded threshold");
        assertThat(c.textBody())
                .contains("Metric: signups")
                .contains("Alert Condition: Forecast exceeds 100 (gt)")
                .contains("Triggered Value: 105.46")
                .contains("Forecast Horizon: 14 days");
        assertThat(c.triggerValue()).isEqualTo(105.456);
        assertThat(c.horizonDays()).isEqualTo(14);
    }

    @Test
    void downwardRuleSaysDroppedBelow() {
        AlertContent c = builder.build(rule(ConditionOperator.LTE, null), 80);

        assertThat(c.subject()).isEqualTo("Alert: signups forecast dropped below threshold");
        assertThat(c.textBody()).contains("Forecast drops below 100 (lte)");
    }

    @Test
    void htmlBodyEscapesUserText() {
        AlertContent c = builder.build(rule(ConditionOperator.GT, "<b>check</b> funnel"), 120);

        assertThat(c.htmlBody()).contains("&lt;b&gt;check&lt;/b&gt; funnel").doesNotContain("<b>check");
        assertThat(c.textBody()).contains("<b>check</b> funnel");
    }
}

package com.intent.vision.core.service.alert;

import com.intent.vision.core.config.AlertProperties;
import com.intent.vision.core.dto.AlertCondition;
import com.intent.vision.core.dto.AlertContent;
import com.intent.vision.core.dto.AlertRule;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.util.Locale;

/**
 * Renders the notification for a triggered rule once; every channel gets the same content.
 */
@Component
public class AlertContentBuilder {

    private final AlertProperties props;

    public AlertContentBuilder(AlertProperties props) {
        this.props = props;
    }

    public AlertContent build(AlertRule rule, double triggerValue) {
        AlertCondition condition = rule.getCondition();
        String metric = rule.getMetricName();
        boolean upward = condition.operator().isUpward();

        String subject = String.format("Alert: %s forecast %s threshold", metric, upward ? "exceeded" : "dropped below");
        String conditionText = String.format(Locale.ROOT, "Forecast %s %s (%s)",
                upward ? "exceeds" : "drops below", format(condition.value()), condition.operator().code());
        String triggered = String.format(Locale.ROOT, "%.2f", triggerValue);
        String horizon = rule.getHorizonDays() + " days";

        StringBuilder text = new StringBuilder()
                .append("IntentVision forecast alert\n\n")
                .append("Metric: ").append(metric).append('\n')
                .append("Alert Condition: ").append(conditionText).append('\n')
                .append("Triggered Value: ").append(triggered).append('\n')
                .append("Forecast Horizon: ").append(horizon).append('\n');
        if (rule.getDescription() != null && !rule.getDescription().isBlank()) {
            text.append('\n').append(rule.getDescription()).append('\n');
        }
        text.append("\nView dashboard: ").append(props.getDashboardUrl()).append('\n');

        StringBuilder html = new StringBuilder()
                .append("<h2>").append(esc(subject)).append("</h2>")
                .append("<table>")
                .append(row("Metric", metric))
                .append(row("Alert Condition", conditionText))
                .append(row("Triggered Value", triggered))
                .append(row("Forecast Horizon", horizon))
                .append("</table>");
        if (rule.getDescription() != null && !rule.getDescription().isBlank()) {
            html.append("<p>").append(esc(rule.getDescription())).append("</p>");
        }
        html.append("<p><a href=\"").append(esc(props.getDashboardUrl())).append("\">View dashboard</a></p>");

        return new AlertContent(subject, text.toString(), html.toString(), metric, triggerValue, condition,
                rule.getHorizonDays());
    }

    private static String row(String label, String value) {
        return "<tr><td><strong>" + esc(label) + "</strong></td><td>" + esc(value) + "</td></tr>";
    }

    private static String esc(String s) {
        return HtmlUtils.htmlEscape(s == null ? "" : s);
    }

    // 100.0 -> "100", 99.5 -> "99.5"
    private static String format(double v) {
        if (v == Math.rint(v) && !Double.isInfinite(v)) {
            return String.valueOf((long) v);
        }
        return String.valueOf(v);
    }
}

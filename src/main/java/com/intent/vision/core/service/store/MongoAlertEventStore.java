package com.intent.vision.core.service.store;

import com.intent.vision.core.dto.AlertCondition;
import com.intent.vision.core.dto.AlertEvent;
import com.intent.vision.core.dto.ChannelDeliveryResult;
import com.intent.vision.core.enums.ChannelType;
import com.intent.vision.core.enums.ConditionOperator;
import com.intent.vision.core.enums.DeliveryStatus;
import com.intent.vision.core.model.documents.AlertEventDoc;
import com.intent.vision.core.repo.documents.AlertEventRepo;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
public class MongoAlertEventStore implements AlertEventStore {

    private final AlertEventRepo repo;

    public MongoAlertEventStore(AlertEventRepo repo) {
        this.repo = repo;
    }

    @Override
    public AlertEvent save(AlertEvent event) {
        AlertEventDoc saved = repo.save(toDoc(event));
        return new AlertEvent(saved.getId(), event.orgId(), event.ruleId(), event.metricName(), event.triggeredAt(),
                event.triggerValue(), event.condition(), event.channelResults(), event.overallStatus());
    }

    @Override
    public List<AlertEvent> findByRule(String orgId, String ruleId) {
        return repo.findByOrgIdAndRuleIdOrderByTriggeredAtDesc(orgId, ruleId).stream()
                .map(MongoAlertEventStore::toEvent)
                .toList();
    }

    private static AlertEventDoc toDoc(AlertEvent e) {
        List<AlertEventDoc.ChannelResult> results = e.channelResults().stream()
                .map(r -> new AlertEventDoc.ChannelResult(r.channelType() == null ? null : r.channelType().code(),
                        lower(r.status()), r.externalId(), r.error(), r.recipients()))
                .toList();
        return AlertEventDoc.builder()
                .id(e.id())
                .orgId(e.orgId())
                .ruleId(e.ruleId())
                .metricName(e.metricName())
                .triggeredAt(e.triggeredAt())
                .triggerValue(e.triggerValue())
                .operator(e.condition().operator().code())
                .threshold(e.condition().value())
                .channelResults(results)
                .overallStatus(lower(e.overallStatus()))
                .build();
    }

    private static AlertEvent toEvent(AlertEventDoc d) {
        List<ChannelDeliveryResult> results = d.getChannelResults() == null ? List.of() : d.getChannelResults().stream()
                .map(r -> new ChannelDeliveryResult(r.getChannelType() == null ? null
                                : ChannelType.valueOf(r.getChannelType().toUpperCase(Locale.ROOT)),
                        DeliveryStatus.valueOf(r.getStatus().toUpperCase(Locale.ROOT)),
                        r.getExternalId(), r.getError(), r.getRecipients()))
                .toList();
        return new AlertEvent(d.getId(), d.getOrgId(), d.getRuleId(), d.getMetricName(), d.getTriggeredAt(),
                d.getTriggerValue(), new AlertCondition(ConditionOperator.fromCode(d.getOperator()), d.getThreshold()),
                results, DeliveryStatus.valueOf(d.getOverallStatus().toUpperCase(Locale.ROOT)));
    }

    private static String lower(Enum<?> e) {
        return e.name().toLowerCase(Locale.ROOT);
    }
}

package com.intent.vision.core.service.store;

import com.intent.vision.core.dto.AlertEvent;

import java.util.List;

public interface AlertEventStore {

    /**
     * Persists the event and returns it with its assigned id.
     */
    AlertEvent save(AlertEvent event);

    /**
     * Past firings of a rule, newest first.
     */
    List<AlertEvent> findByRule(String orgId, String ruleId);
}

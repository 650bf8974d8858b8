package com.intent.vision.core.service.backend;

import com.intent.vision.core.dto.BackendPolicy;
import com.intent.vision.core.enums.PlanId;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import static com.intent.vision.core.enums.ForecastBackendType.LLM;
import static com.intent.vision.core.enums.ForecastBackendType.NIXTLA;
import static com.intent.vision.core.enums.ForecastBackendType.STATISTICAL;

/**
 * Built-in plan catalogue.
 * <pre>
 * plan        default      nixtla/day  llm/day  history  horizon
 * free        statistical  disabled    disabled   365      30
 * starter     statistical  10          5          730      90
 * growth      nixtla       100         50        1095     180
 * enterprise  nixtla       unlimited   unlimited  unlimited 365
 * </pre>
 */
@Component
public class StaticBackendPolicyProvider implements BackendPolicyProvider {

    private final Map<PlanId, BackendPolicy> policies;

    public StaticBackendPolicyProvider() {
        Map<PlanId, BackendPolicy> m = new EnumMap<>(PlanId.class);
        m.put(PlanId.FREE, new BackendPolicy(STATISTICAL, Set.of(STATISTICAL),
                Map.of(NIXTLA, BackendPolicy.DISABLED, LLM, BackendPolicy.DISABLED), 365, 30));
        m.put(PlanId.STARTER, new BackendPolicy(STATISTICAL, Set.of(STATISTICAL, NIXTLA, LLM),
                Map.of(NIXTLA, 10, LLM, 5), 730, 90));
        m.put(PlanId.GROWTH, new BackendPolicy(NIXTLA, Set.of(STATISTICAL, NIXTLA, LLM),
                Map.of(NIXTLA, 100, LLM, 50), 1095, 180));
        m.put(PlanId.ENTERPRISE, new BackendPolicy(NIXTLA, Set.of(STATISTICAL, NIXTLA, LLM),
                Map.of(NIXTLA, BackendPolicy.UNLIMITED, LLM, BackendPolicy.UNLIMITED), 0, 365));
        this.policies = Collections.unmodifiableMap(m);
    }

    @Override
    public BackendPolicy getBackendPolicy(PlanId planId) {
        return policies.get(planId);
    }
}

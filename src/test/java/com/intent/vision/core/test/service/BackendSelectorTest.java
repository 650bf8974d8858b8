package com.intent.vision.core.test.service;

import com.intent.vision.core.common.exception.PlanLimitExceededException;
import com.intent.vision.core.config.ForecastProperties;
import com.intent.vision.core.core.InMemoryFastStateStore;
import com.intent.vision.core.dto.BackendAvailability;
import com.intent.vision.core.dto.BackendSelectionResult;
import com.intent.vision.core.dto.QuotaStatus;
import com.intent.vision.core.enums.ForecastBackendType;
import com.intent.vision.core.enums.PlanId;
import com.intent.vision.core.service.backend.BackendSelector;
import com.intent.vision.core.service.backend.CostEstimator;
import com.intent.vision.core.service.backend.StaticBackendPolicyProvider;
import com.intent.vision.core.service.backend.UsageTracker;
import com.intent.vision.core.test.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static com.intent.vision.core.enums.ForecastBackendType.LLM;
import static com.intent.vision.core.enums.ForecastBackendType.NIXTLA;
import static com.intent.vision.core.enums.ForecastBackendType.STATISTICAL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackendSelectorTest {

    private static final String ORG = "org-1";

    private MutableClock clock;
    private UsageTracker usage;
    private StaticBackendPolicyProvider policies;
    private BackendSelector selector;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-05-10T21:00:00Z"));
        usage = new UsageTracker(new InMemoryFastStateStore("t:", clock), new ForecastProperties(), clock);
        policies = new StaticBackendPolicyProvider();
        selector = new BackendSelector(policies, usage, new CostEstimator());
    }

    @Test
    void permittedBackendIsSelectedWithCost() {
        BackendSelectionResult r = selector.select(ORG, PlanId.STARTER, NIXTLA, 100, 7);

        assertThat(r.getSelectedBackend()).isEqualTo(NIXTLA);
        assertThat(r.isFallback()).isFalse();
        assertThat(r.getWarning()).isNull();
        assertThat(r.getRationale()).isNotBlank();
        assertThat(r.getCostEstimate().credits()).isEqualTo(2);
        assertThat(r.getCostEstimate().usdEstimate()).isEqualTo(0.02);
    }

    @Test
    void noRequestUsesPlanDefault() {
        assertThat(selector.select(ORG, PlanId.STARTER, null, 10, 7).getSelectedBackend()).isEqualTo(STATISTICAL);

        BackendSelectionResult growth = selector.select(ORG, PlanId.GROWTH, null, 10, 7);
        assertThat(growth.getSelectedBackend()).isEqualTo(NIXTLA);
        assertThat(growth.getRationale()).contains("plan default");
    }

    @Test
    void backendOutsidePlanFallsBackToDefaultWithWarning() {
        BackendSelectionResult r = selector.select(ORG, PlanId.FREE, LLM, 10, 7);

        assertThat(r.getSelectedBackend()).isEqualTo(STATISTICAL);
        assertThat(r.getFallbackFrom()).isEqualTo(LLM);
        assertThat(r.getWarning()).isEqualTo("llm backend is not available on your plan. Upgrade to access premium forecasting.");
        assertThat(r.getRationale()).contains("not permitted");
        assertThat(r.getCostEstimate().credits()).isZero();
    }

    @Test
    void neverSelectsBackendOutsidePlan() {
        for (PlanId plan : PlanId.values()) {
            for (ForecastBackendType requested : new ForecastBackendType[]{null, STATISTICAL, NIXTLA, LLM}) {
                BackendSelectionResult r = selector.select(ORG, plan, requested, 10, 7);
                assertThat(policies.getBackendPolicy(plan).isAllowed(r.getSelectedBackend()))
                        .as("%s on %s", requested, plan)
                        .isTrue();
                assertThat(r.getRationale()).isNotBlank();
            }
        }
    }

    @Test
    void exhaustedQuotaFallsBackToStatisticalUntilNextDay() {
        for (int i = 0; i < 10; i++) {
            assertThat(selector.select(ORG, PlanId.STARTER, NIXTLA, 10, 7).getSelectedBackend()).isEqualTo(NIXTLA);
            usage.incrementUsage(ORG, NIXTLA);
        }

        BackendSelectionResult exhausted = selector.select(ORG, PlanId.STARTER, NIXTLA, 10, 7);
        assertThat(exhausted.getSelectedBackend()).isEqualTo(STATISTICAL);
        assertThat(exhausted.getFallbackFrom()).isEqualTo(NIXTLA);
        assertThat(exhausted.getWarning())
                .isEqualTo("Daily nixtla limit reached (10/10). Upgrade for more capacity or try again tomorrow.");
        assertThat(exhausted.getRationale()).isEqualTo("quota exceeded, fell back to statistical");

        // other orgs and other backends are unaffected
        assertThat(selector.select("org-2", PlanId.STARTER, NIXTLA, 10, 7).getSelectedBackend()).isEqualTo(NIXTLA);
        assertThat(selector.select(ORG, PlanId.STARTER, LLM, 10, 7).getSelectedBackend()).isEqualTo(LLM);

        clock.advance(Duration.ofHours(3)); // past UTC midnight

        assertThat(selector.select(ORG, PlanId.STARTER, NIXTLA, 10, 7).getSelectedBackend()).isEqualTo(NIXTLA);
    }

    @Test
    void unlimitedPlanIsNeverDowngradedForQuota() {
        for (int i = 0; i < 500; i++) {
            usage.incrementUsage(ORG, NIXTLA);
        }

        assertThat(selector.select(ORG, PlanId.ENTERPRISE, NIXTLA, 10, 7).getSelectedBackend()).isEqualTo(NIXTLA);
    }

    @Test
    void historyOrHorizonBeyondPlanIsRejected() {
        assertThatThrownBy(() -> selector.select(ORG, PlanId.FREE, null, 366, 7))
                .isInstanceOf(PlanLimitExceededException.class)
                .hasMessageContaining("365");
        assertThatThrownBy(() -> selector.select(ORG, PlanId.FREE, null, 10, 31))
                .isInstanceOf(PlanLimitExceededException.class)
                .extracting("errorCode").isEqualTo("ERR-PLAN-001");

        assertThat(selector.select(ORG, PlanId.FREE, null, 365, 30).getSelectedBackend()).isEqualTo(STATISTICAL);
    }

    @Test
    void enterpriseHistoryIsUnlimited() {
        assertThat(selector.select(ORG, PlanId.ENTERPRISE, null, 1_000_000, 365).getSelectedBackend()).isEqualTo(NIXTLA);
    }

    @Test
    void remainingQuotaReflectsUsage() {
        usage.incrementUsage(ORG, LLM);
        usage.incrementUsage(ORG, LLM);

        QuotaStatus starter = selector.getRemainingQuota(ORG, PlanId.STARTER, LLM);
        assertThat(starter.allowed()).isTrue();
        assertThat(starter.current()).isEqualTo(2);
        assertThat(starter.limit()).isEqualTo(5);
        assertThat(starter.remaining()).isEqualTo(3);

        assertThat(selector.getRemainingQuota(ORG, PlanId.ENTERPRISE, LLM).remaining()).isEqualTo(-1);

        QuotaStatus free = selector.getRemainingQuota(ORG, PlanId.FREE, LLM);
        assertThat(free.allowed()).isFalse();
        assertThat(free.upgradeMessage()).contains("not available on your plan");
    }

    @Test
    void availabilityExplainsExhaustedQuota() {
        for (int i = 0; i < 5; i++) {
            usage.incrementUsage(ORG, LLM);
        }

        BackendAvailability llm = selector.isBackendAvailable(ORG, PlanId.STARTER, LLM);
        assertThat(llm.available()).isFalse();
        assertThat(llm.reason()).startsWith("Daily llm limit reached (5/5)");

        assertThat(selector.isBackendAvailable(ORG, PlanId.FREE, STATISTICAL).available()).isTrue();
    }

    @Test
    void quotaWarningReportsActualUsage() {
        for (int i = 0; i < 12; i++) {
            usage.incrementUsage(ORG, NIXTLA);
        }

        assertThat(selector.select(ORG, PlanId.STARTER, NIXTLA, 10, 7).getWarning())
                .startsWith("Daily nixtla limit reached (12/10)");
        assertThat(selector.getRemainingQuota(ORG, PlanId.STARTER, NIXTLA).upgradeMessage())
                .startsWith("Daily nixtla limit reached (12/10)");
    }
}

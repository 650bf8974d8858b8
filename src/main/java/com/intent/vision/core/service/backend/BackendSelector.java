package com.intent.vision.core.service.backend;

import com.intent.vision.core.common.exception.InvalidParameterException;
import com.intent.vision.core.common.exception.PlanLimitExceededException;
import com.intent.vision.core.dto.BackendAvailability;
import com.intent.vision.core.dto.BackendPolicy;
import com.intent.vision.core.dto.BackendSelectionResult;
import com.intent.vision.core.dto.QuotaStatus;
import com.intent.vision.core.enums.ForecastBackendType;
import com.intent.vision.core.enums.PlanId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Routes a forecast request to a backend the organization's plan permits.
 * <p>
 * Quota problems never fail a selection; they downgrade it to the statistical
 * backend with a warning. Only requests larger than the plan allows are
 * rejected. Usage is not counted here: the caller counts after a successful
 * run.
 */
@Service
@Slf4j
public class BackendSelector {

    private final BackendPolicyProvider policies;
    private final UsageTracker usage;
    private final CostEstimator costs;

    public BackendSelector(BackendPolicyProvider policies, UsageTracker usage, CostEstimator costs) {
        this.policies = policies;
        this.usage = usage;
        this.costs = costs;
    }

    /**
     * @param requested null means "plan default"
     * @throws PlanLimitExceededException when history or horizon exceed the plan
     */
    public BackendSelectionResult select(String orgId, PlanId planId, ForecastBackendType requested,
                                         int historyPoints, int horizonDays) {
        if (historyPoints < 0) {
            throw new InvalidParameterException("historyPoints must not be negative");
        }
        if (horizonDays <= 0) {
            throw new InvalidParameterException("horizonDays must be positive");
        }
        BackendPolicy policy = policy(planId);
        String plan = planId.name().toLowerCase(Locale.ROOT);

        if (policy.maxHistoryPoints() != BackendPolicy.UNLIMITED && historyPoints > policy.maxHistoryPoints()) {
            throw new PlanLimitExceededException(String.format(
                    "History of %d points exceeds the %s plan limit of %d points",
                    historyPoints, plan, policy.maxHistoryPoints()));
        }
        if (horizonDays > policy.maxHorizonDays()) {
            throw new PlanLimitExceededException(String.format(
                    "Horizon of %d days exceeds the %s plan limit of %d days",
                    horizonDays, plan, policy.maxHorizonDays()));
        }

        ForecastBackendType candidate;
        ForecastBackendType fallbackFrom = null;
        String warning = null;
        String rationale;

        if (requested == null) {
            candidate = policy.defaultBackend();
            rationale = "plan default (" + candidate.code() + ")";
        } else if (!policy.isAllowed(requested) || policy.dailyLimit(requested) == BackendPolicy.DISABLED) {
            candidate = policy.defaultBackend();
            fallbackFrom = requested;
            warning = disabledMessage(requested);
            rationale = "requested backend not permitted for plan, using plan default (" + candidate.code() + ")";
        } else {
            candidate = requested;
            rationale = "requested backend " + candidate.code();
        }

        int limit = policy.dailyLimit(candidate);
        if (limit == BackendPolicy.DISABLED) {
            if (fallbackFrom == null) {
                fallbackFrom = candidate;
            }
            warning = disabledMessage(candidate);
            candidate = ForecastBackendType.STATISTICAL;
            rationale = "backend disabled for plan, fell back to statistical";
        } else if (limit > 0) {
            long used = usage.getUsage(orgId, candidate);
            if (used >= limit) {
                log.info("quota exhausted org={} backend={} used={} limit={}", orgId, candidate.code(), used, limit);
                if (fallbackFrom == null) {
                    fallbackFrom = candidate;
                }
                warning = quotaMessage(candidate, used, limit);
                candidate = ForecastBackendType.STATISTICAL;
                rationale = "quota exceeded, fell back to statistical";
            }
        }

        BackendSelectionResult result = BackendSelectionResult.builder()
                .selectedBackend(candidate)
                .rationale(rationale)
                .fallbackFrom(fallbackFrom)
                .warning(warning)
                .costEstimate(costs.estimate(candidate, historyPoints, horizonDays))
                .build();
        log.debug("backend selected org={} plan={} result={}", orgId, plan, result);
        return result;
    }

    public QuotaStatus getRemainingQuota(String orgId, PlanId planId, ForecastBackendType backend) {
        BackendPolicy policy = policy(planId);
        int limit = policy.dailyLimit(backend);
        if (!policy.isAllowed(backend) || limit == BackendPolicy.DISABLED) {
            return new QuotaStatus(false, 0, BackendPolicy.DISABLED, 0, disabledMessage(backend));
        }
        long current = backend.isPaid() ? usage.getUsage(orgId, backend) : 0;
        if (limit == BackendPolicy.UNLIMITED) {
            return new QuotaStatus(true, current, limit, -1, null);
        }
        boolean allowed = current < limit;
        return new QuotaStatus(allowed, current, limit, Math.max(0, limit - current),
                allowed ? null : quotaMessage(backend, current, limit));
    }

    public BackendAvailability isBackendAvailable(String orgId, PlanId planId, ForecastBackendType backend) {
        QuotaStatus quota = getRemainingQuota(orgId, planId, backend);
        return quota.allowed() ? BackendAvailability.yes() : BackendAvailability.no(quota.upgradeMessage());
    }

    private BackendPolicy policy(PlanId planId) {
        if (planId == null) {
            throw new InvalidParameterException("Plan id is required");
        }
        BackendPolicy policy = policies.getBackendPolicy(planId);
        if (policy == null) {
            throw new InvalidParameterException("No backend policy for plan " + planId);
        }
        return policy;
    }

    static String quotaMessage(ForecastBackendType backend, long used, int limit) {
        return String.format("Daily %s limit reached (%d/%d). Upgrade for more capacity or try again tomorrow.",
                backend.code(), used, limit);
    }

    static String disabledMessage(ForecastBackendType backend) {
        return backend.code() + " backend is not available on your plan. Upgrade to access premium forecasting.";
    }
}

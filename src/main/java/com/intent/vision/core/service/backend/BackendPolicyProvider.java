package com.intent.vision.core.service.backend;

import com.intent.vision.core.dto.BackendPolicy;
import com.intent.vision.core.enums.PlanId;

/**
 * Plan to routing policy lookup. Must be pure: same plan, same policy.
 */
public interface BackendPolicyProvider {

    BackendPolicy getBackendPolicy(PlanId planId);
}

package ai.agentcap.router.orch.policy;

import lombok.Builder;

import java.util.List;

/**
 * Execution constraints. Registered per agent as the binding policy, and also carried on each
 * {@link PolicyExecutionRequest} as the caller's declared parameters and route filters.
 *
 * @param privacyFloor  minimum privacy tier
 * @param maxCost       cost ceiling per execution
 * @param maxSlippage   slippage ceiling, in percent
 * @param maxLatencyMs  latency preference
 */
@Builder(toBuilder = true)
public record ExecutionPolicy(PrivacyTier privacyFloor,
                              Double maxCost,
                              Double maxSlippage,
                              Long maxLatencyMs,
                              List<String> preferredRoutes,
                              List<String> excludedRoutes,
                              List<String> trustedCounterparties,
                              List<String> blockedCounterparties) {

    public ExecutionPolicy {
        preferredRoutes = preferredRoutes == null ? List.of() : List.copyOf(preferredRoutes);
        excludedRoutes = excludedRoutes == null ? List.of() : List.copyOf(excludedRoutes);
        trustedCounterparties = trustedCounterparties == null ? List.of() : List.copyOf(trustedCounterparties);
        blockedCounterparties = blockedCounterparties == null ? List.of() : List.copyOf(blockedCounterparties);
    }

    public static ExecutionPolicy unrestricted() {
        return ExecutionPolicy.builder().build();
    }

    /** Cost ×1.5 and latency ×2, used for the single fallback selection. */
    ExecutionPolicy relaxed() {
        return toBuilder()
                .maxCost(maxCost == null ? null : maxCost * 1.5d)
                .maxLatencyMs(maxLatencyMs == null ? null : maxLatencyMs * 2)
                .build();
    }
}

package ai.agentcap.router.model;

import ai.agentcap.router.orch.economics.EconomicHints;
import ai.agentcap.router.spi.SettlementSignal;
import lombok.Builder;

/**
 * Metadata attached to every {@link InvocationResult}.
 *
 * @param execution        execution statistics of the call that produced the outputs
 * @param economicHints    payment hints derived from the capability's declared economics
 * @param settlementSignal external settlement/telemetry signal, null when emission failed
 * @param privacyLevel     0 for public execution, 2 for confidential
 * @param cached           served from the response cache
 * @param deduplicated     served from the short-lived content-hash cache
 * @param retryAfterMs     remaining breaker cooldown, only set for circuit-open rejections
 */
@Builder(toBuilder = true)
public record InvocationMetadata(ExecutionMetadata execution,
                                 EconomicHints economicHints,
                                 SettlementSignal settlementSignal,
                                 int privacyLevel,
                                 boolean cached,
                                 boolean deduplicated,
                                 Long retryAfterMs) {

    public InvocationMetadata {
        execution = execution == null ? ExecutionMetadata.none() : execution;
        economicHints = economicHints == null ? EconomicHints.none() : economicHints;
    }

    public static InvocationMetadata empty() {
        return InvocationMetadata.builder().build();
    }
}

package ai.agentcap.router.orch.policy;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * @param capabilityType   route family, e.g. {@code swap} or {@code price}
 * @param policy           declared parameters and route filters; null means unrestricted
 * @param fallbacksAllowed whether one relaxed route selection may follow a failed one
 */
@Builder
public record PolicyExecutionRequest(String agentId,
                                     String capabilityType,
                                     Map<String, Object> inputs,
                                     ExecutionPolicy policy,
                                     String counterparty,
                                     Double slippage,
                                     boolean fallbacksAllowed) {

    public PolicyExecutionRequest {
        Objects.requireNonNull(capabilityType, "capabilityType");
        inputs = inputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        policy = policy == null ? ExecutionPolicy.unrestricted() : policy;
    }
}

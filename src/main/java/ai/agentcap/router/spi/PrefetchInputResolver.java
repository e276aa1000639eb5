package ai.agentcap.router.spi;

import ai.agentcap.router.model.InvocationRequest;

import java.util.Map;
import java.util.Optional;

/**
 * Supplies inputs for speculative invocations. Given the request that just succeeded and a
 * predicted successor capability, returns the inputs to warm the successor with, or empty
 * to only mark the prediction pending.
 */
@FunctionalInterface
public interface PrefetchInputResolver {

    Optional<Map<String, Object>> resolve(InvocationRequest completed, String predictedCapabilityId);

    static PrefetchInputResolver none() {
        return (completed, predicted) -> Optional.empty();
    }
}

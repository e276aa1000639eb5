package ai.agentcap.router.orch.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One way of fulfilling a capability type: which capability to invoke, through which plugins,
 * at what privacy tier and estimated cost/latency. {@code params} are merged over the caller's
 * inputs at execution time.
 */
public record Route(String id,
                    String capabilityId,
                    List<String> plugins,
                    PrivacyTier privacyTier,
                    double estimatedCost,
                    long estimatedLatencyMs,
                    Map<String, Object> params) {

    public Route {
        plugins = plugins == null ? List.of() : List.copyOf(plugins);
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    Map<String, Object> describe() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", id);
        m.put("capability_id", capabilityId);
        m.put("plugins", plugins);
        m.put("privacy_level", privacyTier.label());
        m.put("estimated_cost", estimatedCost);
        m.put("estimated_latency", estimatedLatencyMs);
        return m;
    }
}

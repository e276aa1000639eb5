package ai.agentcap.router.orch;

import ai.agentcap.router.orch.breaker.BreakerSnapshot;

import java.util.List;
import java.util.Map;

public record RouterStatus(List<String> executors, Map<String, BreakerSnapshot> circuitBreakers, int capabilitiesRegistered) {

    public RouterStatus {
        executors = List.copyOf(executors);
        circuitBreakers = Map.copyOf(circuitBreakers);
    }
}

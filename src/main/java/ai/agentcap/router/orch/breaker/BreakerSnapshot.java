package ai.agentcap.router.orch.breaker;

public record BreakerSnapshot(BreakerMode mode, int failures, long lastFailureTime) {
}

package ai.agentcap.router.orch.health;

/**
 * @param successRate  percentage of successful attempts, 0-100
 * @param avgLatencyMs mean attempt latency
 * @param totalCalls   attempts observed
 */
public record HealthScore(String capabilityId, double successRate, double avgLatencyMs, long totalCalls) {
}

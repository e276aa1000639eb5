package ai.agentcap.router.orch.prefetch;

/**
 * @param probability share of the predecessor's outgoing edge weight, in [0, 1]
 * @param avgGapMs    mean time between the predecessor and this capability
 */
public record Prediction(String capabilityId, double probability, double avgGapMs) {
}

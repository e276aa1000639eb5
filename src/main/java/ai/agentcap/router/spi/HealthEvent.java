package ai.agentcap.router.spi;

public record HealthEvent(String capabilityId,
                          String executor,
                          boolean success,
                          long latencyMs,
                          String error,
                          long timestamp) {
}

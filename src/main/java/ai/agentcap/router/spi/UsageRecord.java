package ai.agentcap.router.spi;

/**
 * What the router reports to the settlement channel after an invocation.
 */
public record UsageRecord(String capabilityId,
                          String requestId,
                          long timestamp,
                          boolean success,
                          double cost,
                          String currency,
                          long executionTimeMs) {
}

package ai.agentcap.router.spi;

/**
 * Fire-and-forget sink for per-invocation metrics. Called off the request thread.
 */
@FunctionalInterface
public interface InvocationMetricsCollector {

    void record(String capabilityId, boolean success, long latencyMs, double cost);

    static InvocationMetricsCollector noop() {
        return (capabilityId, success, latencyMs, cost) -> {
        };
    }
}

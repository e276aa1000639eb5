package ai.agentcap.router.metrics;

import ai.agentcap.router.spi.InvocationMetricsCollector;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters per capability.
 *
 * <p>Tags stay low-cardinality: capability id and outcome only.</p>
 */
public final class MicrometerInvocationMetrics implements InvocationMetricsCollector {

    private final MeterRegistry registry; // may be null (fail-soft)
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, DistributionSummary> costs = new ConcurrentHashMap<>();

    public MicrometerInvocationMetrics(MeterRegistry registry, String prefix) {
        this.registry = registry;
        this.prefix = (prefix == null || prefix.isBlank()) ? "cap.router" : prefix;
    }

    @Override
    public void record(String capabilityId, boolean success, long latencyMs, double cost) {
        if (registry == null) {
            return;
        }
        String capability = safeTag(capabilityId);
        String outcome = success ? "success" : "failure";
        String key = capability + "|" + outcome;

        counters.computeIfAbsent(key, k -> Counter.builder(prefix + ".invocations")
                        .tag("capability", capability)
                        .tag("outcome", outcome)
                        .register(registry))
                .increment();
        timers.computeIfAbsent(key, k -> Timer.builder(prefix + ".latency")
                        .tag("capability", capability)
                        .tag("outcome", outcome)
                        .register(registry))
                .record(Math.max(0L, latencyMs), TimeUnit.MILLISECONDS);
        if (cost > 0) {
            costs.computeIfAbsent(capability, k -> DistributionSummary.builder(prefix + ".cost")
                            .tag("capability", capability)
                            .register(registry))
                    .record(cost);
        }
    }

    private static String safeTag(String raw) {
        if (raw == null) {
            return "none";
        }
        String s = raw.trim();
        if (s.isEmpty()) {
            return "none";
        }
        if (s.length() > 64) {
            s = s.substring(0, 64);
        }
        return s.toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}

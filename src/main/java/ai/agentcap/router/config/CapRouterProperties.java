package ai.agentcap.router.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Capability router tuning knobs.
 *
 * <p>
 * Every group is optional; the defaults reproduce the router's stock behaviour
 * (5-failure breaker with a 30s cooldown, 3 attempts with 1s exponential backoff,
 * 1000-entry response cache starting at a 5s ttl, 10 concurrent queued invocations).
 */
@ConfigurationProperties(prefix = "cap.router")
public class CapRouterProperties {

    /** Master switch for the auto-configuration. */
    private boolean enabled = true;

    private final Breaker breaker = new Breaker();
    private final Retry retry = new Retry();
    private final Cache cache = new Cache();
    private final Dedup dedup = new Dedup();
    private final Scheduler scheduler = new Scheduler();
    private final Prefetch prefetch = new Prefetch();
    private final Worker worker = new Worker();
    private final Maintenance maintenance = new Maintenance();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Breaker getBreaker() {
        return breaker;
    }

    public Retry getRetry() {
        return retry;
    }

    public Cache getCache() {
        return cache;
    }

    public Dedup getDedup() {
        return dedup;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Prefetch getPrefetch() {
        return prefetch;
    }

    public Worker getWorker() {
        return worker;
    }

    public Maintenance getMaintenance() {
        return maintenance;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Breaker {
        /** Consecutive failures that open the circuit. */
        private int failureThreshold = 5;

        /** How long an open circuit rejects before admitting a half-open trial. */
        private long cooldownMs = 30_000L;

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public long getCooldownMs() {
            return cooldownMs;
        }

        public void setCooldownMs(long cooldownMs) {
            this.cooldownMs = cooldownMs;
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private long baseDelayMs = 1_000L;

        /** Upper bound of the uniform jitter, as a fraction of the backoff delay. */
        private double jitterRatio = 0.3d;

        /** Per-attempt deadline. */
        private long attemptTimeoutMs = 30_000L;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public double getJitterRatio() {
            return jitterRatio;
        }

        public void setJitterRatio(double jitterRatio) {
            this.jitterRatio = jitterRatio;
        }

        public long getAttemptTimeoutMs() {
            return attemptTimeoutMs;
        }

        public void setAttemptTimeoutMs(long attemptTimeoutMs) {
            this.attemptTimeoutMs = attemptTimeoutMs;
        }
    }

    public static class Cache {
        private int maxEntries = 1_000;
        private long initialTtlMs = 5_000L;
        private long minTtlMs = 1_000L;
        private long maxTtlMs = 60_000L;

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }

        public long getInitialTtlMs() {
            return initialTtlMs;
        }

        public void setInitialTtlMs(long initialTtlMs) {
            this.initialTtlMs = initialTtlMs;
        }

        public long getMinTtlMs() {
            return minTtlMs;
        }

        public void setMinTtlMs(long minTtlMs) {
            this.minTtlMs = minTtlMs;
        }

        public long getMaxTtlMs() {
            return maxTtlMs;
        }

        public void setMaxTtlMs(long maxTtlMs) {
            this.maxTtlMs = maxTtlMs;
        }
    }

    public static class Dedup {
        private long ttlMs = 5_000L;
        private int maxEntries = 500;

        public long getTtlMs() {
            return ttlMs;
        }

        public void setTtlMs(long ttlMs) {
            this.ttlMs = ttlMs;
        }

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }
    }

    public static class Scheduler {
        /** Global ceiling for queued invocations running at once. */
        private int maxConcurrent = 10;

        public int getMaxConcurrent() {
            return maxConcurrent;
        }

        public void setMaxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
        }
    }

    public static class Prefetch {
        private boolean enabled = true;

        /** Consecutive calls further apart than this are not linked. */
        private long maxGapMs = 30_000L;

        private double probabilityThreshold = 0.3d;

        /** Bound on tracked predecessor capabilities. */
        private int maxSources = 500;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getMaxGapMs() {
            return maxGapMs;
        }

        public void setMaxGapMs(long maxGapMs) {
            this.maxGapMs = maxGapMs;
        }

        public double getProbabilityThreshold() {
            return probabilityThreshold;
        }

        public void setProbabilityThreshold(double probabilityThreshold) {
            this.probabilityThreshold = probabilityThreshold;
        }

        public int getMaxSources() {
            return maxSources;
        }

        public void setMaxSources(int maxSources) {
            this.maxSources = maxSources;
        }
    }

    public static class Worker {
        private int poolSize = 16;

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }
    }

    public static class Maintenance {
        /** Periodic breaker/cache sweep. Off by default; {@code performMaintenance()} works either way. */
        private boolean enabled = false;
        private long intervalMs = 60_000L;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;

        /** Meter name prefix, e.g. {@code cap.router.invocations}. */
        private String prefix = "cap.router";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }
    }
}

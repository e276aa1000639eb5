package ai.agentcap.router.orch.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-capability cache ttl that follows the observed hit ratio.
 *
 * <p>A capability that keeps hitting (more than 10 hits, ratio above 0.8) gets a 20% longer
 * ttl on each further hit, up to the ceiling. One that keeps missing (more than 10 misses,
 * miss ratio above 0.5) gets 20% shorter on each further miss, down to the floor.</p>
 */
public final class AdaptiveTtlTracker {

    private static final int MIN_SAMPLES = 10;
    private static final double HIT_RATIO_TO_GROW = 0.8d;
    private static final double MISS_RATIO_TO_SHRINK = 0.5d;
    private static final double GROWTH = 1.2d;
    private static final double SHRINK = 0.8d;

    /** Read-only view of one capability's ttl state. */
    public record AdaptiveTtl(long ttlMs, long hits, long misses) {
    }

    private static final class State {
        long ttlMs;
        long hits;
        long misses;

        State(long ttlMs) {
            this.ttlMs = ttlMs;
        }
    }

    private final ConcurrentHashMap<String, State> states = new ConcurrentHashMap<>();
    private final long initialTtlMs;
    private final long minTtlMs;
    private final long maxTtlMs;

    public AdaptiveTtlTracker(long initialTtlMs, long minTtlMs, long maxTtlMs) {
        if (minTtlMs <= 0 || minTtlMs > initialTtlMs || initialTtlMs > maxTtlMs) {
            throw new IllegalArgumentException(
                    "ttl bounds must satisfy 0 < min <= initial <= max: " + minTtlMs + "/" + initialTtlMs + "/" + maxTtlMs);
        }
        this.initialTtlMs = initialTtlMs;
        this.minTtlMs = minTtlMs;
        this.maxTtlMs = maxTtlMs;
    }

    public void recordHit(String capabilityId) {
        State s = state(capabilityId);
        synchronized (s) {
            s.hits++;
            double ratio = (double) s.hits / (s.hits + s.misses);
            if (s.hits > MIN_SAMPLES && ratio > HIT_RATIO_TO_GROW) {
                s.ttlMs = Math.min(Math.round(s.ttlMs * GROWTH), maxTtlMs);
            }
        }
    }

    public void recordMiss(String capabilityId) {
        State s = state(capabilityId);
        synchronized (s) {
            s.misses++;
            double ratio = (double) s.misses / (s.hits + s.misses);
            if (s.misses > MIN_SAMPLES && ratio > MISS_RATIO_TO_SHRINK) {
                s.ttlMs = Math.max(Math.round(s.ttlMs * SHRINK), minTtlMs);
            }
        }
    }

    public Duration ttlFor(String capabilityId) {
        State s = states.get(capabilityId);
        if (s == null) {
            return Duration.ofMillis(initialTtlMs);
        }
        synchronized (s) {
            return Duration.ofMillis(s.ttlMs);
        }
    }

    public Optional<AdaptiveTtl> inspect(String capabilityId) {
        State s = states.get(capabilityId);
        if (s == null) {
            return Optional.empty();
        }
        synchronized (s) {
            return Optional.of(new AdaptiveTtl(s.ttlMs, s.hits, s.misses));
        }
    }

    public int trackedCount() {
        return states.size();
    }

    public void clear() {
        states.clear();
    }

    private State state(String capabilityId) {
        return states.computeIfAbsent(capabilityId, k -> new State(initialTtlMs));
    }
}

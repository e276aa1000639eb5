package ai.agentcap.router.orch.cache;

import ai.agentcap.router.model.InvocationResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Successful invocation results keyed by the canonical (capability, inputs) key, each stored
 * with the capability's current adaptive ttl. Lookups feed the ttl tracker.
 */
@Slf4j
public class ResponseCache {

    private final BoundedCache<String, InvocationResult> entries;
    private final AdaptiveTtlTracker ttl;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public ResponseCache(int maxEntries, AdaptiveTtlTracker ttl, Clock clock) {
        this.entries = new BoundedCache<>(maxEntries, clock);
        this.ttl = ttl;
    }

    public Optional<InvocationResult> lookup(String capabilityId, String key) {
        Optional<InvocationResult> hit = entries.get(key);
        if (hit.isPresent()) {
            hits.incrementAndGet();
            ttl.recordHit(capabilityId);
        } else {
            misses.incrementAndGet();
            ttl.recordMiss(capabilityId);
        }
        return hit;
    }

    /** Stores successful results only; failures are never cached. */
    public void store(String capabilityId, String key, InvocationResult result) {
        if (result == null || !result.success()) {
            return;
        }
        Duration d = ttl.ttlFor(capabilityId);
        entries.put(key, result, d);
        log.trace("[cache] stored {} ttl={}ms", capabilityId, d.toMillis());
    }

    public int evictExpired() {
        return entries.evictExpired();
    }

    public CacheStats stats() {
        return CacheStats.of(entries.size(), hits.get(), misses.get());
    }

    public AdaptiveTtlTracker ttlTracker() {
        return ttl;
    }

    public void clear() {
        entries.clear();
    }
}

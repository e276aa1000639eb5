package ai.agentcap.router.orch.cache;

import ai.agentcap.router.model.InvocationResult;
import ai.agentcap.router.orch.trace.CapDigest;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Short-lived dedup table: content hash of {capabilityId, inputs} to a successful result.
 */
public class ContentHashCache {

    private final BoundedCache<String, InvocationResult> entries;
    private final Duration defaultTtl;

    public ContentHashCache(int maxEntries, Duration defaultTtl, Clock clock) {
        this.entries = new BoundedCache<>(maxEntries, clock);
        this.defaultTtl = defaultTtl;
    }

    public static String hash(String capabilityId, Map<String, ?> inputs) {
        return CapDigest.contentHash(capabilityId, inputs);
    }

    public Optional<InvocationResult> lookup(String hash) {
        return entries.get(hash);
    }

    public void store(String hash, InvocationResult result, Duration ttl) {
        if (result == null || !result.success()) {
            return;
        }
        entries.put(hash, result, ttl == null ? defaultTtl : ttl);
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    public long size() {
        return entries.size();
    }

    public int evictExpired() {
        return entries.evictExpired();
    }

    public void clear() {
        entries.clear();
    }
}

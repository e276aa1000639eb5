package ai.agentcap.router.orch.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Capacity-bounded map with a per-entry expiry, shared by the response cache, the
 * content-hash cache and the dependency learner.
 *
 * <p>Backed by Caffeine with a variable expiry driven by the router clock. Reads also compare
 * {@link Entry#expiresAtMillis()} against the clock, so an entry is never handed out after it
 * expired even if Caffeine has not swept it yet.</p>
 */
public final class BoundedCache<K, V> {

    public static final long NEVER = Long.MAX_VALUE;

    public record Entry<V>(V value, long expiresAtMillis) {
        boolean expiredAt(long nowMillis) {
            return expiresAtMillis != NEVER && nowMillis >= expiresAtMillis;
        }
    }

    private final Cache<K, Entry<V>> cache;
    private final Clock clock;
    private final long maxEntries;

    public BoundedCache(long maxEntries, Clock clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0: " + maxEntries);
        }
        this.clock = clock;
        this.maxEntries = maxEntries;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new ClockExpiry<K, V>(clock))
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    public Optional<V> get(K key) {
        Entry<V> e = cache.getIfPresent(key);
        if (e == null) {
            return Optional.empty();
        }
        if (e.expiredAt(clock.millis())) {
            cache.asMap().remove(key, e);
            return Optional.empty();
        }
        return Optional.ofNullable(e.value());
    }

    public void put(K key, V value, Duration ttl) {
        long expiresAt = clock.millis() + Math.max(0L, ttl.toMillis());
        cache.put(key, new Entry<>(value, expiresAt));
    }

    /** Stores without expiry; the entry leaves only through capacity eviction or removal. */
    public void put(K key, V value) {
        cache.put(key, new Entry<>(value, NEVER));
    }

    /** Returns the live value for {@code key}, creating a non-expiring one when absent. */
    public V getOrCreate(K key, Function<? super K, ? extends V> factory) {
        long now = clock.millis();
        Entry<V> e = cache.asMap().compute(key, (k, cur) ->
                (cur == null || cur.expiredAt(now)) ? new Entry<>(factory.apply(k), NEVER) : cur);
        return e.value();
    }

    /** Stores {@code value} without expiry and returns the previous live value, if any. */
    public Optional<V> getAndPut(K key, V value) {
        Entry<V> prev = cache.asMap().put(key, new Entry<>(value, NEVER));
        if (prev == null || prev.expiredAt(clock.millis())) {
            return Optional.empty();
        }
        return Optional.ofNullable(prev.value());
    }

    public boolean remove(K key) {
        return cache.asMap().remove(key) != null;
    }

    public boolean containsKey(K key) {
        return get(key).isPresent();
    }

    /** Drops expired entries, returning how many were removed. */
    public int evictExpired() {
        long before = cache.estimatedSize();
        long now = clock.millis();
        cache.asMap().entrySet().removeIf(e -> e.getValue().expiredAt(now));
        cache.cleanUp();
        return (int) Math.max(0L, before - cache.estimatedSize());
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public long maxEntries() {
        return maxEntries;
    }

    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    /** Live (non-expired) entries at the time of the call. */
    public Map<K, V> snapshot() {
        long now = clock.millis();
        Map<K, V> out = new LinkedHashMap<>();
        cache.asMap().forEach((k, e) -> {
            if (!e.expiredAt(now)) {
                out.put(k, e.value());
            }
        });
        return out;
    }

    private static final class ClockExpiry<K, V> implements Expiry<K, Entry<V>> {

        private final Clock clock;

        ClockExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(K key, Entry<V> value, long currentTime) {
            return remainingNanos(value);
        }

        @Override
        public long expireAfterUpdate(K key, Entry<V> value, long currentTime, long currentDuration) {
            return remainingNanos(value);
        }

        @Override
        public long expireAfterRead(K key, Entry<V> value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(Entry<V> value) {
            if (value.expiresAtMillis() == NEVER) {
                return Long.MAX_VALUE;
            }
            long remaining = Math.max(0L, value.expiresAtMillis() - clock.millis());
            return TimeUnit.MILLISECONDS.toNanos(remaining);
        }
    }
}

package ai.agentcap.router.orch.health;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling per-capability success rate and latency, fed by every executor attempt.
 *
 * <p>Advisory only: concurrent updates from different callers may interleave. Bounded to
 * {@code maxEntries}; when full, the least recently updated capability is evicted.</p>
 */
public class HealthScoreBoard {

    public static final int DEFAULT_MAX_ENTRIES = 200;

    private static final class Stats {
        long success;
        long total;
        double avgLatency;
        long lastUpdate;
    }

    private final ConcurrentHashMap<String, Stats> stats = new ConcurrentHashMap<>();
    private final int maxEntries;
    private final Clock clock;

    public HealthScoreBoard(Clock clock) {
        this(DEFAULT_MAX_ENTRIES, clock);
    }

    public HealthScoreBoard(int maxEntries, Clock clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    public void record(String capabilityId, boolean success, long latencyMs) {
        if (!stats.containsKey(capabilityId) && stats.size() >= maxEntries) {
            evictOldest();
        }
        Stats s = stats.computeIfAbsent(capabilityId, k -> new Stats());
        synchronized (s) {
            s.total++;
            if (success) {
                s.success++;
            }
            s.avgLatency = s.avgLatency + (latencyMs - s.avgLatency) / s.total;
            s.lastUpdate = clock.millis();
        }
    }

    public Optional<HealthScore> score(String capabilityId) {
        Stats s = stats.get(capabilityId);
        if (s == null) {
            return Optional.empty();
        }
        return Optional.of(toScore(capabilityId, s));
    }

    /** All scores, busiest capability first. */
    public List<HealthScore> all() {
        return stats.entrySet().stream()
                .map(e -> toScore(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingLong(HealthScore::totalCalls).reversed()
                        .thenComparing(HealthScore::capabilityId))
                .toList();
    }

    public int size() {
        return stats.size();
    }

    public void clear() {
        stats.clear();
    }

    private void evictOldest() {
        String oldest = null;
        long oldestTs = Long.MAX_VALUE;
        for (Map.Entry<String, Stats> e : stats.entrySet()) {
            long ts;
            synchronized (e.getValue()) {
                ts = e.getValue().lastUpdate;
            }
            if (ts < oldestTs) {
                oldestTs = ts;
                oldest = e.getKey();
            }
        }
        if (oldest != null) {
            stats.remove(oldest);
        }
    }

    private static HealthScore toScore(String id, Stats s) {
        synchronized (s) {
            double rate = s.total == 0 ? 0d : (s.success * 100d) / s.total;
            return new HealthScore(id, rate, s.avgLatency, s.total);
        }
    }
}

package ai.agentcap.router.orch.prefetch;

import ai.agentcap.router.orch.cache.BoundedCache;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Learns which capability a caller tends to invoke next.
 *
 * <p>When the same caller invokes B within {@code maxGapMs} after a different capability A, the
 * edge A→B gains one unit of weight and its mean gap is updated. Edges only accumulate; the
 * tables are bounded by capacity eviction.</p>
 */
@Slf4j
public class DependencyLearner {

    private record LastCall(String capabilityId, long at) {
    }

    private static final class Edge {
        long weight;
        double avgGapMs;
    }

    private final BoundedCache<String, ConcurrentHashMap<String, Edge>> edges;
    private final BoundedCache<String, LastCall> lastCallByCaller;
    private final long maxGapMs;
    private final Clock clock;

    public DependencyLearner(int maxSources, long maxGapMs, Clock clock) {
        if (maxGapMs <= 0) {
            throw new IllegalArgumentException("maxGapMs must be > 0: " + maxGapMs);
        }
        this.edges = new BoundedCache<>(maxSources, clock);
        this.lastCallByCaller = new BoundedCache<>(maxSources, clock);
        this.maxGapMs = maxGapMs;
        this.clock = clock;
    }

    public void observe(String callerId, String capabilityId) {
        long now = clock.millis();
        Optional<LastCall> prev = lastCallByCaller.getAndPut(callerId, new LastCall(capabilityId, now));
        if (prev.isEmpty()) {
            return;
        }
        LastCall last = prev.get();
        long gap = now - last.at();
        if (last.capabilityId().equals(capabilityId) || gap >= maxGapMs) {
            return;
        }
        Edge e = edges.getOrCreate(last.capabilityId(), k -> new ConcurrentHashMap<>())
                .computeIfAbsent(capabilityId, k -> new Edge());
        synchronized (e) {
            e.avgGapMs = (e.avgGapMs * e.weight + gap) / (e.weight + 1);
            e.weight++;
        }
        log.trace("[prefetch] learned {} -> {} gap={}ms", last.capabilityId(), capabilityId, gap);
    }

    /**
     * Top {@code n} successors of {@code capabilityId} by edge weight.
     */
    public List<Prediction> predictNext(String capabilityId, int n) {
        Optional<ConcurrentHashMap<String, Edge>> succ = edges.get(capabilityId);
        if (succ.isEmpty() || n <= 0) {
            return List.of();
        }
        List<Map.Entry<String, double[]>> rows = new ArrayList<>();
        long total = 0;
        for (Map.Entry<String, Edge> entry : succ.get().entrySet()) {
            Edge e = entry.getValue();
            synchronized (e) {
                total += e.weight;
                rows.add(Map.entry(entry.getKey(), new double[]{e.weight, e.avgGapMs}));
            }
        }
        if (total == 0) {
            return List.of();
        }
        double sum = total;
        return rows.stream()
                .map(r -> new Prediction(r.getKey(), r.getValue()[0] / sum, r.getValue()[1]))
                .sorted(Comparator.comparingDouble(Prediction::probability).reversed()
                        .thenComparing(Prediction::capabilityId))
                .limit(n)
                .toList();
    }

    public long trackedSources() {
        return edges.size();
    }

    public void clear() {
        edges.clear();
        lastCallByCaller.clear();
    }
}

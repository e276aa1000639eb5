package ai.agentcap.router.orch.schedule;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Named concurrency pools. Each pool has its own ceiling, fixed by the first call that names
 * it, and a fair semaphore so waiters are admitted in arrival order.
 */
@Slf4j
public class BulkheadRegistry {

    public record BulkheadStats(int maxConcurrent, int active, int waiting) {
    }

    private static final class Pool {
        final int maxConcurrent;
        final Semaphore permits;
        final AtomicInteger active = new AtomicInteger();

        Pool(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
            this.permits = new Semaphore(maxConcurrent, true);
        }
    }

    private final ConcurrentHashMap<String, Pool> pools = new ConcurrentHashMap<>();

    public <T> T withBulkhead(String name, int maxConcurrent, Supplier<T> task) throws InterruptedException {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be > 0: " + maxConcurrent);
        }
        Pool pool = pools.computeIfAbsent(name, k -> {
            log.debug("[bulkhead] created pool '{}' max={}", k, maxConcurrent);
            return new Pool(maxConcurrent);
        });
        pool.permits.acquire();
        pool.active.incrementAndGet();
        try {
            return task.get();
        } finally {
            pool.active.decrementAndGet();
            pool.permits.release();
        }
    }

    public Map<String, BulkheadStats> stats() {
        Map<String, BulkheadStats> out = new TreeMap<>();
        pools.forEach((name, p) ->
                out.put(name, new BulkheadStats(p.maxConcurrent, p.active.get(), p.permits.getQueueLength())));
        return out;
    }
}

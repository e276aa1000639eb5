package ai.agentcap.router.orch.coalesce;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * At most one in-flight execution per key. The first caller runs the task on its own thread;
 * callers arriving while it runs join the same future and get the same result.
 */
@Slf4j
public class SingleFlightCoalescer<T> {

    private final ConcurrentHashMap<String, CompletableFuture<T>> inflight = new ConcurrentHashMap<>();
    private final AtomicLong coalesced = new AtomicLong();

    public T run(String key, Supplier<T> task) {
        CompletableFuture<T> mine = new CompletableFuture<>();
        CompletableFuture<T> existing = inflight.putIfAbsent(key, mine);
        if (existing != null) {
            coalesced.incrementAndGet();
            log.debug("[coalesce] joined in-flight execution for {}", key);
            return join(existing);
        }
        try {
            T result = task.get();
            mine.complete(result);
            return result;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inflight.remove(key, mine);
        }
    }

    /** The pending future for {@code key}, if an execution is in flight. */
    public CompletableFuture<T> pending(String key) {
        return inflight.get(key);
    }

    public int inflightCount() {
        return inflight.size();
    }

    public long coalescedCount() {
        return coalesced.get();
    }

    private static <T> T join(CompletableFuture<T> f) {
        try {
            return f.join();
        } catch (CompletionException ce) {
            Throwable cause = ce.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw ce;
        }
    }
}

package ai.agentcap.router.orch.exec;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * MDC-propagating executor used for the router's worker threads.
 *
 * <p>Every task inherits the submitting thread's MDC (requestId/capabilityId) and restores
 * the worker's previous MDC afterwards, so log lines stay correlated across the hop.</p>
 */
@Slf4j
public class BackgroundTasks implements Executor, AutoCloseable {

    private final ExecutorService delegate;
    private final boolean owned;

    public BackgroundTasks(int poolSize) {
        this(fixedPool(poolSize, "cap-router-worker-"), true);
    }

    public BackgroundTasks(ExecutorService delegate) {
        this(delegate, false);
    }

    private BackgroundTasks(ExecutorService delegate, boolean owned) {
        this.delegate = delegate;
        this.owned = owned;
    }

    /**
     * Unbounded pool for work that itself waits on the worker pool (batch fan-out, queued
     * dispatch, prefetch warm-ups), so it can never starve executor attempts.
     */
    public static BackgroundTasks elastic(String threadPrefix) {
        return new BackgroundTasks(Executors.newCachedThreadPool(daemonFactory(threadPrefix)), true);
    }

    private static ExecutorService fixedPool(int poolSize, String threadPrefix) {
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be > 0: " + poolSize);
        }
        return Executors.newFixedThreadPool(poolSize, daemonFactory(threadPrefix));
    }

    private static ThreadFactory daemonFactory(String threadPrefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, threadPrefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public void execute(Runnable command) {
        delegate.execute(wrap(command, MDC.getCopyOfContextMap()));
    }

    public <T> CompletableFuture<T> supply(Supplier<T> supplier) {
        return CompletableFuture.supplyAsync(supplier, this);
    }

    /**
     * Runs a side-channel task whose failure must never reach the caller.
     */
    public void fireAndForget(String label, Runnable task) {
        try {
            execute(() -> {
                try {
                    task.run();
                } catch (Throwable t) {
                    log.debug("[cap-router] background task '{}' failed: {}", label, t.toString());
                }
            });
        } catch (RuntimeException rejected) {
            log.debug("[cap-router] background task '{}' rejected: {}", label, rejected.toString());
        }
    }

    private static Runnable wrap(Runnable task, Map<String, String> mdc) {
        return () -> {
            Map<String, String> prev = MDC.getCopyOfContextMap();
            try {
                applyMdc(mdc);
                task.run();
            } finally {
                applyMdc(prev);
            }
        };
    }

    private static void applyMdc(Map<String, String> mdc) {
        if (mdc == null || mdc.isEmpty()) {
            MDC.clear();
        } else {
            MDC.setContextMap(mdc);
        }
    }

    @Override
    public void close() {
        if (!owned) {
            return;
        }
        delegate.shutdown();
        try {
            if (!delegate.awaitTermination(2, TimeUnit.SECONDS)) {
                delegate.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            delegate.shutdownNow();
        }
    }
}

package ai.agentcap.router.orch.retry;

import ai.agentcap.router.model.ExecutionContext;
import ai.agentcap.router.model.ExecutionMetadata;
import ai.agentcap.router.model.ExecutionOutcome;
import ai.agentcap.router.orch.health.HealthScoreBoard;
import ai.agentcap.router.spi.CapabilityExecutor;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Runs executor attempts against a per-attempt deadline and retries transient failures with
 * exponential backoff plus jitter.
 *
 * <p>Retry is a resilience4j {@link Retry} whose interval function computes the backoff and
 * whose result predicate skips caller errors. Attempts run on the worker pool. The deadline is a
 * resilience4j {@link TimeLimiter} with {@code cancelRunningFuture(false)}: an attempt that misses
 * it is abandoned, not interrupted, and whatever it eventually returns is ignored.</p>
 */
@Slf4j
public class RetryTimeoutEngine {

    private final int maxAttempts;
    private final long baseDelayMs;
    private final double jitterRatio;
    private final Duration attemptTimeout;
    private final TimeLimiter timeLimiter;
    private final Executor worker;
    private final DoubleSupplier random;
    private final Clock clock;
    private final HealthScoreBoard health;
    private final ConcurrentHashMap<Integer, Retry> retries = new ConcurrentHashMap<>();

    public RetryTimeoutEngine(int maxAttempts,
                              long baseDelayMs,
                              double jitterRatio,
                              Duration attemptTimeout,
                              Executor worker,
                              DoubleSupplier random,
                              Clock clock,
                              HealthScoreBoard health) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0: " + maxAttempts);
        }
        if (baseDelayMs < 0 || jitterRatio < 0) {
            throw new IllegalArgumentException("backoff settings must be >= 0");
        }
        if (attemptTimeout == null || attemptTimeout.isNegative() || attemptTimeout.isZero()) {
            throw new IllegalArgumentException("attemptTimeout must be positive: " + attemptTimeout);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = baseDelayMs;
        this.jitterRatio = jitterRatio;
        this.attemptTimeout = attemptTimeout;
        this.timeLimiter = limiter(attemptTimeout);
        this.worker = worker;
        this.random = random == null ? () -> ThreadLocalRandom.current().nextDouble() : random;
        this.clock = clock;
        this.health = health;
    }

    public ExecutionOutcome executeWithRetry(CapabilityExecutor executor, ExecutionContext context) {
        return executeWithRetry(executor, context, maxAttempts);
    }

    public ExecutionOutcome executeWithRetry(CapabilityExecutor executor, ExecutionContext context, int attempts) {
        int max = Math.max(1, attempts);
        String capabilityId = context.capabilityId();
        AtomicInteger attempt = new AtomicInteger();
        AtomicReference<String> lastError = new AtomicReference<>();

        Callable<ExecutionOutcome> base = () -> {
            int n = attempt.incrementAndGet();
            ExecutionOutcome out = attemptOnce(executor, context, n);
            if (!out.success()) {
                lastError.set(out.error());
                if (n < max && !FailureClassifier.isCallerError(out.error())) {
                    log.debug("[retry] {} attempt {}/{} failed ({})", capabilityId, n, max, out.error());
                }
            }
            return out;
        };

        ExecutionOutcome out;
        try {
            out = Retry.decorateCallable(retryFor(max), base).call();
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            String msg = lastError.get() == null ? message(e) : lastError.get();
            if (FailureClassifier.isCallerError(msg)) {
                return ExecutionOutcome.failure(msg, complete(null, executor, 0L, Math.max(1, attempt.get())));
            }
            return terminal(executor, Math.max(1, attempt.get()), msg);
        }
        if (out.success() || FailureClassifier.isCallerError(out.error())) {
            return out;
        }
        log.debug("[retry] {} giving up after {} attempts: {}", capabilityId, attempt.get(), out.error());
        return terminal(executor, attempt.get(), out.error());
    }

    /**
     * Retry instance for an attempt limit. Failed outcomes are retried unless the error names a
     * caller mistake; the wait before retry {@code n} is {@link #backoffDelay(int)}.
     */
    Retry retryFor(int attempts) {
        return retries.computeIfAbsent(attempts, n -> Retry.of("cap-router-retry-" + n,
                RetryConfig.<ExecutionOutcome>custom()
                        .maxAttempts(n)
                        .intervalBiFunction((attempt, result) -> backoffDelay(attempt))
                        .retryOnResult(o -> o != null && !o.success() && !FailureClassifier.isCallerError(o.error()))
                        .retryOnException(t -> !FailureClassifier.isCallerError(message(t)))
                        .failAfterMaxAttempts(false)
                        .build()));
    }

    /** One attempt under the deadline; thrown errors and timeouts come back as failed outcomes. */
    private ExecutionOutcome attemptOnce(CapabilityExecutor executor, ExecutionContext context, int attempt) {
        String capabilityId = context.capabilityId();
        long start = clock.millis();
        try {
            ExecutionOutcome out = timeLimiter.executeFutureSupplier(() -> runAttempt(executor, context));
            long latency = clock.millis() - start;
            if (out == null) {
                out = ExecutionOutcome.failure("Executor " + executor.name() + " returned no outcome", null);
            }
            health.record(capabilityId, out.success(), latency);
            if (out.success() || FailureClassifier.isCallerError(out.error())) {
                return out.withMetadata(complete(out.metadata(), executor, latency, attempt));
            }
            return out;
        } catch (TimeoutException te) {
            health.record(capabilityId, false, clock.millis() - start);
            return ExecutionOutcome.failure("Attempt timed out after " + attemptTimeout.toMillis() + "ms", null);
        } catch (Exception e) {
            long latency = clock.millis() - start;
            health.record(capabilityId, false, latency);
            String error = message(e);
            if (FailureClassifier.isCallerError(error)) {
                return ExecutionOutcome.failure(error, complete(null, executor, latency, attempt));
            }
            return ExecutionOutcome.failure(error, null);
        }
    }

    /**
     * {@code base * 2^(attempt-1)} plus uniform jitter in {@code [0, jitterRatio)} of that delay.
     */
    long backoffDelay(int attempt) {
        long exp = baseDelayMs * (1L << Math.min(attempt - 1, 30));
        double jitter = random.getAsDouble() * jitterRatio * exp;
        return exp + (long) jitter;
    }

    /**
     * Runs {@code supplier} on the worker pool and returns {@code fallback} when it misses the
     * deadline or fails.
     */
    public <T> T withTimeoutFallback(Supplier<T> supplier, Duration timeout, T fallback) {
        try {
            return limiter(timeout).executeFutureSupplier(() -> CompletableFuture.supplyAsync(supplier, worker));
        } catch (TimeoutException te) {
            log.debug("[retry] timed out after {}ms, using fallback", timeout.toMillis());
            return fallback;
        } catch (Exception e) {
            log.debug("[retry] failed ({}), using fallback", message(e));
            return fallback;
        }
    }

    private CompletableFuture<ExecutionOutcome> runAttempt(CapabilityExecutor executor, ExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return executor.execute(context);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, worker);
    }

    private static ExecutionMetadata complete(ExecutionMetadata md,
                                              CapabilityExecutor executor,
                                              long latency,
                                              int attempts) {
        ExecutionMetadata base = md == null ? ExecutionMetadata.none() : md;
        ExecutionMetadata.ExecutionMetadataBuilder b = base.toBuilder().attempts(attempts);
        if (base.executor() == null || "none".equals(base.executor())) {
            b.executor(executor.name());
        }
        if (base.executionTimeMs() <= 0) {
            b.executionTimeMs(latency);
        }
        return b.build();
    }

    private static ExecutionOutcome terminal(CapabilityExecutor executor, int attempts, String lastError) {
        ExecutionMetadata md = ExecutionMetadata.builder()
                .executor(executor.name())
                .attempts(attempts)
                .note("Failed after " + attempts + " retry attempts")
                .build();
        return ExecutionOutcome.failure("Execution failed after " + attempts + " attempts: " + lastError, md);
    }

    private static TimeLimiter limiter(Duration timeout) {
        return TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(false)
                .build());
    }

    private static String message(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        String m = cur.getMessage();
        return (m == null || m.isBlank()) ? cur.getClass().getSimpleName() : m;
    }
}

package ai.agentcap.router.orch;

import ai.agentcap.router.config.CapRouterProperties;
import ai.agentcap.router.model.CapabilityDescriptor;
import ai.agentcap.router.model.ExecutionContext;
import ai.agentcap.router.model.ExecutionMetadata;
import ai.agentcap.router.model.ExecutionOutcome;
import ai.agentcap.router.model.InvocationErrorKind;
import ai.agentcap.router.model.InvocationMetadata;
import ai.agentcap.router.model.InvocationRequest;
import ai.agentcap.router.model.InvocationResult;
import ai.agentcap.router.model.Priority;
import ai.agentcap.router.orch.breaker.BreakerDashboard;
import ai.agentcap.router.orch.breaker.BreakerDecision;
import ai.agentcap.router.orch.breaker.CircuitBreakerBank;
import ai.agentcap.router.orch.cache.AdaptiveTtlTracker;
import ai.agentcap.router.orch.cache.ContentHashCache;
import ai.agentcap.router.orch.cache.ResponseCache;
import ai.agentcap.router.orch.coalesce.SingleFlightCoalescer;
import ai.agentcap.router.orch.economics.EconomicHintFactory;
import ai.agentcap.router.orch.economics.EconomicHints;
import ai.agentcap.router.orch.exec.BackgroundTasks;
import ai.agentcap.router.orch.health.HealthScore;
import ai.agentcap.router.orch.health.HealthScoreBoard;
import ai.agentcap.router.orch.prefetch.DependencyLearner;
import ai.agentcap.router.orch.prefetch.Prediction;
import ai.agentcap.router.orch.prefetch.Prefetcher;
import ai.agentcap.router.orch.retry.FailureClassifier;
import ai.agentcap.router.orch.retry.RetryTimeoutEngine;
import ai.agentcap.router.orch.schedule.BulkheadRegistry;
import ai.agentcap.router.orch.schedule.EscalationTable;
import ai.agentcap.router.orch.schedule.PriorityScheduler;
import ai.agentcap.router.orch.schedule.QueueStats;
import ai.agentcap.router.orch.trace.CapDigest;
import ai.agentcap.router.spi.CapabilityExecutor;
import ai.agentcap.router.spi.CapabilityHealthMonitor;
import ai.agentcap.router.spi.CapabilityRegistry;
import ai.agentcap.router.spi.HealthEvent;
import ai.agentcap.router.spi.InvocationMetricsCollector;
import ai.agentcap.router.spi.PrefetchInputResolver;
import ai.agentcap.router.spi.SettlementSignal;
import ai.agentcap.router.spi.SettlementSignalEmitter;
import ai.agentcap.router.spi.UsageRecord;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Single dispatch point for capability invocations.
 *
 * <p>{@link #invoke} runs: response cache → single-flight coalescing → capability lookup and
 * input validation → circuit breaker → executor selection → retry/timeout engine → breaker,
 * cache and health updates → metrics (background) → economic hints → settlement signal.</p>
 *
 * <p>Nothing is thrown across this class's public methods: every failure, including unexpected
 * ones inside the router, comes back as an {@link InvocationResult} with an
 * {@link InvocationErrorKind}. All state is per instance and in memory.</p>
 */
@Slf4j
public class InvocationOrchestrator implements AutoCloseable {

    static final String MDC_REQUEST_ID = "requestId";
    static final String MDC_CAPABILITY_ID = "capabilityId";

    private final CapabilityRegistry registry;
    private final List<CapabilityExecutor> executors;
    private final Clock clock;
    private final BackgroundTasks tasks;
    private final boolean ownsTasks;
    private final BackgroundTasks dispatch = BackgroundTasks.elastic("cap-router-dispatch-");
    private final boolean prefetchEnabled;

    private final CircuitBreakerBank breakers;
    private final HealthScoreBoard health;
    private final RetryTimeoutEngine retry;
    private final ResponseCache responseCache;
    private final ContentHashCache contentHashCache;
    private final SingleFlightCoalescer<InvocationResult> coalescer = new SingleFlightCoalescer<>();
    private final PriorityScheduler scheduler;
    private final BulkheadRegistry bulkheads = new BulkheadRegistry();
    private final DependencyLearner learner;
    private final Prefetcher prefetcher;
    private final EconomicHintFactory hints;

    private final CapabilityHealthMonitor healthMonitor;
    private final InvocationMetricsCollector metrics;
    private final SettlementSignalEmitter settlementEmitter;

    /** capabilityId → first accepting executor; the executor list never changes after construction. */
    private final ConcurrentHashMap<String, Optional<CapabilityExecutor>> executorIndex = new ConcurrentHashMap<>();

    @Builder
    private InvocationOrchestrator(CapabilityRegistry registry,
                                   List<CapabilityExecutor> executors,
                                   CapRouterProperties properties,
                                   Clock clock,
                                   BackgroundTasks backgroundTasks,
                                   DoubleSupplier random,
                                   CapabilityHealthMonitor healthMonitor,
                                   InvocationMetricsCollector metricsCollector,
                                   SettlementSignalEmitter settlementEmitter,
                                   PrefetchInputResolver prefetchInputResolver) {
        CapRouterProperties props = properties == null ? new CapRouterProperties() : properties;
        this.registry = Objects.requireNonNull(registry, "registry");
        this.executors = executors == null ? List.of() : List.copyOf(executors);
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.ownsTasks = backgroundTasks == null;
        this.tasks = backgroundTasks == null ? new BackgroundTasks(props.getWorker().getPoolSize()) : backgroundTasks;
        this.prefetchEnabled = props.getPrefetch().isEnabled();

        this.healthMonitor = healthMonitor == null ? CapabilityHealthMonitor.noop() : healthMonitor;
        this.metrics = metricsCollector == null ? InvocationMetricsCollector.noop() : metricsCollector;
        this.settlementEmitter = settlementEmitter;

        CapRouterProperties.Breaker b = props.getBreaker();
        this.breakers = new CircuitBreakerBank(b.getFailureThreshold(), b.getCooldownMs(), this.clock);
        this.health = new HealthScoreBoard(this.clock);

        CapRouterProperties.Retry r = props.getRetry();
        this.retry = new RetryTimeoutEngine(r.getMaxAttempts(), r.getBaseDelayMs(), r.getJitterRatio(),
                Duration.ofMillis(r.getAttemptTimeoutMs()), this.tasks, random, this.clock, this.health);

        CapRouterProperties.Cache c = props.getCache();
        this.responseCache = new ResponseCache(c.getMaxEntries(),
                new AdaptiveTtlTracker(c.getInitialTtlMs(), c.getMinTtlMs(), c.getMaxTtlMs()), this.clock);
        this.contentHashCache = new ContentHashCache(props.getDedup().getMaxEntries(),
                Duration.ofMillis(props.getDedup().getTtlMs()), this.clock);

        this.scheduler = new PriorityScheduler(props.getScheduler().getMaxConcurrent(), this::invoke, this.dispatch,
                this.clock, EscalationTable.defaults());

        CapRouterProperties.Prefetch p = props.getPrefetch();
        this.learner = new DependencyLearner(p.getMaxSources(), p.getMaxGapMs(), this.clock);
        this.prefetcher = new Prefetcher(learner, p.getProbabilityThreshold(), p.getMaxSources(),
                prefetchInputResolver, this.dispatch, this::invoke, this.clock);
        this.hints = new EconomicHintFactory(this.clock);
    }

    // ------------------------------------------------------------------
    // invocation
    // ------------------------------------------------------------------

    public InvocationResult invoke(InvocationRequest request) {
        String requestId = newRequestId();
        String capabilityId = request.capabilityId();
        try (MDC.MDCCloseable ignoredReq = MDC.putCloseable(MDC_REQUEST_ID, requestId);
             MDC.MDCCloseable ignoredCap = MDC.putCloseable(MDC_CAPABILITY_ID, capabilityId)) {
            String key = CapDigest.key(capabilityId, request.inputs());

            Optional<InvocationResult> cached = responseCache.lookup(capabilityId, key);
            if (cached.isPresent()) {
                log.debug("[cap-router] cache hit for {}", capabilityId);
                InvocationResult hit = cached.get();
                return hit.withRequestId(requestId)
                        .withMetadata(hit.metadata().toBuilder().cached(true).deduplicated(false).build());
            }
            return coalescer.run(key, () -> execute(request, requestId, key));
        } catch (RuntimeException e) {
            log.error("[cap-router] unexpected failure invoking {}", capabilityId, e);
            return InvocationResult.failure(requestId, capabilityId, InvocationErrorKind.INTERNAL,
                    "Internal router error: " + e.getMessage());
        }
    }

    private InvocationResult execute(InvocationRequest request, String requestId, String key) {
        String capabilityId = request.capabilityId();
        long start = clock.millis();

        Optional<CapabilityDescriptor> found = registry.getCapability(capabilityId);
        if (found.isEmpty()) {
            return InvocationResult.failure(requestId, capabilityId, InvocationErrorKind.CALLER_ERROR,
                    "Capability not found: " + capabilityId);
        }
        CapabilityDescriptor capability = found.get();

        List<String> missing = new ArrayList<>();
        for (String name : capability.requiredInputs()) {
            if (request.inputs().get(name) == null) {
                missing.add(name);
            }
        }
        if (!missing.isEmpty()) {
            return InvocationResult.failure(requestId, capabilityId, InvocationErrorKind.CALLER_ERROR,
                    "Missing required inputs: " + String.join(", ", missing));
        }

        BreakerDecision decision = breakers.checkAllowed(capabilityId);
        if (!decision.allowed()) {
            log.debug("[cap-router] {} rejected: {}", capabilityId, decision.reason());
            InvocationResult rejected = InvocationResult.failure(requestId, capabilityId,
                    InvocationErrorKind.CIRCUIT_OPEN, decision.reason());
            return rejected.withMetadata(InvocationMetadata.builder().retryAfterMs(decision.retryAfterMs()).build());
        }

        Optional<CapabilityExecutor> executor = selectExecutor(capabilityId);
        if (executor.isEmpty()) {
            breakers.release(capabilityId);
            return InvocationResult.failure(requestId, capabilityId, InvocationErrorKind.NO_EXECUTOR,
                    "No executor available for capability: " + capabilityId);
        }

        ExecutionContext context = ExecutionContext.forRequest(request, requestId, start);
        ExecutionOutcome outcome = retry.executeWithRetry(executor.get(), context);
        breakers.recordResult(capabilityId, outcome.success());

        long latency = clock.millis() - start;
        ExecutionMetadata execution = outcome.metadata();
        double cost = execution.costActual() != null
                ? execution.costActual()
                : (outcome.success() ? capability.economics().costHint() : 0d);

        notifyMonitor(capabilityId, execution.executor(), outcome, latency);
        boolean success = outcome.success();
        dispatch.fireAndForget("metrics", () -> metrics.record(capabilityId, success, latency, cost));

        EconomicHints economicHints = hints.build(capability, execution);
        SettlementSignal signal = emitSignal(new UsageRecord(capabilityId, requestId, clock.millis(),
                success, cost, capability.economics().currency(), execution.executionTimeMs()));

        InvocationMetadata metadata = InvocationMetadata.builder()
                .execution(execution)
                .economicHints(economicHints)
                .settlementSignal(signal)
                .privacyLevel(EconomicHintFactory.privacyLevel(capability))
                .build();

        if (success) {
            InvocationResult result = new InvocationResult(true, requestId, capabilityId, outcome.outputs(),
                    null, null, metadata);
            responseCache.store(capabilityId, key, result);
            return result;
        }
        return new InvocationResult(false, requestId, capabilityId, null, outcome.error(),
                FailureClassifier.classify(outcome.error()), metadata);
    }

    public BatchResult batchInvoke(List<InvocationRequest> requests) {
        long start = clock.millis();
        List<CompletableFuture<InvocationResult>> futures = new ArrayList<>(requests.size());
        for (InvocationRequest req : requests) {
            futures.add(dispatch.supply(() -> invoke(req)));
        }
        List<InvocationResult> results = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            InvocationResult r;
            try {
                r = futures.get(i).join();
            } catch (RuntimeException e) {
                r = InvocationResult.failure(null, requests.get(i).capabilityId(), InvocationErrorKind.INTERNAL,
                        "Internal router error: " + e.getMessage());
            }
            results.add(r);
        }
        long total = clock.millis() - start;
        long summed = results.stream().mapToLong(r -> r.metadata().execution().executionTimeMs()).sum();
        boolean allOk = results.stream().allMatch(InvocationResult::success);
        return new BatchResult(allOk, results, total, Math.max(0L, summed - total));
    }

    public CompletableFuture<InvocationResult> queuedInvoke(InvocationRequest request, Priority priority) {
        return scheduler.enqueue(request, priority);
    }

    /**
     * Serves identical (capability, inputs) payloads from a short-lived content-hash cache.
     *
     * @param ttl how long a successful result stays reusable; null for the configured default
     */
    public InvocationResult deduplicatedInvoke(InvocationRequest request, Duration ttl) {
        String hash = ContentHashCache.hash(request.capabilityId(), request.inputs());
        Optional<InvocationResult> hit = contentHashCache.lookup(hash);
        if (hit.isPresent()) {
            InvocationResult r = hit.get();
            return r.withRequestId(newRequestId())
                    .withMetadata(r.metadata().toBuilder().deduplicated(true).build());
        }
        InvocationResult result = invoke(request);
        contentHashCache.store(hash, result, ttl);
        return result;
    }

    /**
     * Invokes while feeding the dependency learner, then speculatively prefetches likely successors.
     */
    public InvocationResult invokeWithPrefetch(InvocationRequest request) {
        if (prefetchEnabled) {
            learner.observe(request.callerOrAnonymous(), request.capabilityId());
        }
        InvocationResult result = invoke(request);
        if (prefetchEnabled && result.success()) {
            try {
                prefetcher.afterSuccess(request);
            } catch (RuntimeException e) {
                log.debug("[prefetch] skipped after {}: {}", request.capabilityId(), e.toString());
            }
        }
        return result;
    }

    /**
     * Runs {@code task} inside the named bulkhead. Pools are independent of each other and of
     * the queued-invoke ceiling.
     */
    public <T> T withBulkhead(String name, int maxConcurrent, Supplier<T> task)
            throws InterruptedException {
        return bulkheads.withBulkhead(name, maxConcurrent, task);
    }

    // ------------------------------------------------------------------
    // status & maintenance
    // ------------------------------------------------------------------

    public RouterStatus getStatus() {
        List<String> names = executors.stream().map(CapabilityExecutor::name).toList();
        return new RouterStatus(names, breakers.snapshot(), registry.capabilityCount());
    }

    public boolean resetCircuitBreaker(String capabilityId) {
        return breakers.reset(capabilityId);
    }

    public int cleanupCircuitBreakers() {
        return breakers.cleanup();
    }

    public BreakerDashboard getCircuitBreakerDashboard() {
        return breakers.dashboard();
    }

    public Optional<HealthScore> getHealthScore(String capabilityId) {
        return health.score(capabilityId);
    }

    public List<HealthScore> getAllHealthScores() {
        return health.all();
    }

    public QueueStats getQueueStats() {
        return scheduler.stats();
    }

    public Map<String, BulkheadRegistry.BulkheadStats> getBulkheadStats() {
        return bulkheads.stats();
    }

    public PerformanceStats getPerformanceStats() {
        return new PerformanceStats(
                responseCache.stats(),
                coalescer.inflightCount(),
                coalescer.coalescedCount(),
                contentHashCache.size(),
                scheduler.stats(),
                breakers.size(),
                learner.trackedSources(),
                prefetcher.pendingCount());
    }

    public List<Prediction> getPredictedNext(String capabilityId, int topN) {
        return learner.predictNext(capabilityId, topN);
    }

    public boolean isPrefetchPending(String capabilityId) {
        return prefetcher.isPending(capabilityId);
    }

    public MaintenanceReport performMaintenance() {
        MaintenanceReport report = new MaintenanceReport(
                breakers.cleanup(),
                responseCache.evictExpired(),
                contentHashCache.evictExpired(),
                prefetcher.evictExpired());
        log.debug("[cap-router] maintenance {}", report);
        return report;
    }

    /** Adaptive ttl currently applied to new cache entries of {@code capabilityId}. */
    public Duration currentCacheTtl(String capabilityId) {
        return responseCache.ttlTracker().ttlFor(capabilityId);
    }

    @Override
    public void close() {
        dispatch.close();
        if (ownsTasks) {
            tasks.close();
        }
    }

    // ------------------------------------------------------------------
    // internals
    // ------------------------------------------------------------------

    private Optional<CapabilityExecutor> selectExecutor(String capabilityId) {
        return executorIndex.computeIfAbsent(capabilityId, id -> {
            for (CapabilityExecutor ex : executors) {
                if (ex.canExecute(id)) {
                    return Optional.of(ex);
                }
            }
            return Optional.empty();
        });
    }

    private void notifyMonitor(String capabilityId, String executorName, ExecutionOutcome outcome, long latency) {
        try {
            healthMonitor.record(new HealthEvent(capabilityId, executorName, outcome.success(), latency,
                    outcome.error(), clock.millis()));
        } catch (RuntimeException e) {
            log.warn("[cap-router] health monitor failed for {}: {}", capabilityId, e.toString());
        }
    }

    private SettlementSignal emitSignal(UsageRecord usage) {
        if (settlementEmitter == null) {
            return null;
        }
        try {
            return settlementEmitter.emit(usage);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[cap-router] settlement signal interrupted for {}", usage.capabilityId());
            return null;
        } catch (Exception e) {
            log.warn("[cap-router] settlement signal failed for {}: {}", usage.capabilityId(), e.toString());
            return null;
        }
    }

    private String newRequestId() {
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        return "req_" + Long.toString(clock.millis(), 36) + Long.toString(rnd.nextLong(36L * 36 * 36 * 36 * 36 * 36), 36);
    }
}

package ai.agentcap.router.orch;

import ai.agentcap.router.config.CapRouterProperties;
import ai.agentcap.router.model.CapabilityDescriptor;
import ai.agentcap.router.model.CapabilityEconomics;
import ai.agentcap.router.model.ExecutionMetadata;
import ai.agentcap.router.model.ExecutionMode;
import ai.agentcap.router.model.ExecutionOutcome;
import ai.agentcap.router.model.InvocationErrorKind;
import ai.agentcap.router.model.InvocationRequest;
import ai.agentcap.router.model.InvocationResult;
import ai.agentcap.router.model.PaymentSignalConfig;
import ai.agentcap.router.model.Priority;
import ai.agentcap.router.orch.breaker.BreakerDashboard;
import ai.agentcap.router.orch.breaker.BreakerMode;
import ai.agentcap.router.orch.breaker.BreakerSnapshot;
import ai.agentcap.router.orch.exec.BackgroundTasks;
import ai.agentcap.router.signal.CommitmentSignalEmitter;
import ai.agentcap.router.spi.CapabilityExecutor;
import ai.agentcap.router.spi.CapabilityHealthMonitor;
import ai.agentcap.router.spi.HealthEvent;
import ai.agentcap.router.spi.InMemoryCapabilityRegistry;
import ai.agentcap.router.spi.PrefetchInputResolver;
import ai.agentcap.router.support.Await;
import ai.agentcap.router.support.MutableClock;
import ai.agentcap.router.support.ScriptedExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class InvocationOrchestratorTest {

    private static final String PRICE = "cap.price.lookup.v1";
    private static final String SWAP = "cap.swap.execute.v1";
    private static final String FLAKY = "cap.flaky.v1";

    private final MutableClock clock = new MutableClock();
    private final List<InvocationOrchestrator> opened = new ArrayList<>();
    private BackgroundTasks tasks;
    private InMemoryCapabilityRegistry registry;
    private ScriptedExecutor priceExec;
    private ScriptedExecutor swapExec;

    @BeforeEach
    void setUp() {
        tasks = new BackgroundTasks(8);
        registry = new InMemoryCapabilityRegistry()
                .register(CapabilityDescriptor.publicCapability(PRICE, List.of("token")))
                .register(CapabilityDescriptor.publicCapability(SWAP, List.of("token")))
                .register(CapabilityDescriptor.publicCapability(FLAKY, List.of()));
        priceExec = ScriptedExecutor.succeeding("price-exec", PRICE);
        swapExec = ScriptedExecutor.succeeding("swap-exec", SWAP);
    }

    @AfterEach
    void tearDown() {
        opened.forEach(InvocationOrchestrator::close);
        tasks.close();
    }

    private InvocationOrchestrator.InvocationOrchestratorBuilder base(CapabilityExecutor... executors) {
        return InvocationOrchestrator.builder()
                .registry(registry)
                .executors(List.of(executors))
                .clock(clock)
                .backgroundTasks(tasks)
                .properties(fastRetry())
                .random(() -> 0d);
    }

    private static CapRouterProperties fastRetry() {
        CapRouterProperties props = new CapRouterProperties();
        props.getRetry().setBaseDelayMs(1L);
        return props;
    }

    private InvocationOrchestrator open(InvocationOrchestrator.InvocationOrchestratorBuilder builder) {
        InvocationOrchestrator o = builder.build();
        opened.add(o);
        return o;
    }

    private static InvocationRequest price(String token) {
        return InvocationRequest.of(PRICE, Map.of("token", token));
    }

    @Test
    void successfulInvocationCarriesOutputsAndMetadata() {
        InvocationOrchestrator router = open(base(priceExec));

        InvocationResult r = router.invoke(price("SOL"));

        assertThat(r.success()).isTrue();
        assertThat(r.requestId()).matches("req_[0-9a-z]+");
        assertThat(r.capabilityId()).isEqualTo(PRICE);
        assertThat(r.outputs()).containsEntry("echo", PRICE);
        assertThat(r.error()).isNull();
        assertThat(r.errorKind()).isNull();
        assertThat(r.metadata().execution().executor()).isEqualTo("price-exec");
        assertThat(r.metadata().execution().attempts()).isEqualTo(1);
        assertThat(r.metadata().cached()).isFalse();
        assertThat(r.metadata().privacyLevel()).isZero();
        assertThat(r.metadata().settlementSignal()).isNull();
        assertThat(priceExec.seen()).singleElement()
                .satisfies(ctx -> assertThat(ctx.requestId()).isEqualTo(r.requestId()));
        assertThat(router.getHealthScore(PRICE)).hasValueSatisfying(h -> assertThat(h.totalCalls()).isEqualTo(1));
    }

    @Test
    void identicalRequestIsServedFromCache() {
        InvocationOrchestrator router = open(base(priceExec));

        InvocationResult first = router.invoke(price("SOL"));
        InvocationResult second = router.invoke(price("SOL"));
        router.invoke(price("ETH"));

        assertThat(priceExec.calls()).isEqualTo(2);
        assertThat(second.metadata().cached()).isTrue();
        assertThat(second.requestId()).isNotEqualTo(first.requestId());
        assertThat(second.outputs()).isEqualTo(first.outputs());
        assertThat(router.getPerformanceStats().cache().hits()).isEqualTo(1);
        assertThat(router.getPerformanceStats().cache().misses()).isEqualTo(2);
    }

    @Test
    void inputsThatRenderAlikeWithoutEscapingGetSeparateCacheEntries() {
        ScriptedExecutor echo = new ScriptedExecutor("echo-exec", Set.of(FLAKY),
                ctx -> ExecutionOutcome.success(Map.of("inputs", ctx.inputs()), ExecutionMetadata.of("echo-exec", 1)));
        InvocationOrchestrator router = open(base(echo));

        InvocationResult a = router.invoke(InvocationRequest.of(FLAKY, Map.of("a", "x", "b", "y")));
        InvocationResult b = router.invoke(InvocationRequest.of(FLAKY, Map.of("a", "x\",b:\"y")));

        assertThat(echo.calls()).isEqualTo(2);
        assertThat(b.metadata().cached()).isFalse();
        assertThat(b.outputs()).isNotEqualTo(a.outputs());
        assertThat(b.outputs().get("inputs")).isEqualTo(Map.of("a", "x\",b:\"y"));
    }

    @Test
    void cacheHitLeavesBreakerStateUntouched() {
        InvocationOrchestrator router = open(base(priceExec));
        router.invoke(price("SOL"));
        Map<String, BreakerSnapshot> before = router.getStatus().circuitBreakers();

        InvocationResult hit = router.invoke(price("SOL"));

        assertThat(hit.metadata().cached()).isTrue();
        assertThat(router.getStatus().circuitBreakers()).isEqualTo(before);
    }

    @Test
    void cachedEntryIsServedWhileBreakerIsOpenWithoutTouchingIt() {
        ScriptedExecutor exec = new ScriptedExecutor("flaky-exec", Set.of(FLAKY),
                ctx -> ExecutionOutcome.success(Map.of("ok", true), ExecutionMetadata.of("flaky-exec", 1)));
        InvocationOrchestrator router = open(base(exec));
        InvocationRequest cachedReq = InvocationRequest.of(FLAKY, Map.of("k", 1));
        assertThat(router.invoke(cachedReq).success()).isTrue();

        exec.behave(ctx -> ExecutionOutcome.failure("Pool not found", null));
        for (int i = 0; i < 5; i++) {
            router.invoke(InvocationRequest.of(FLAKY, Map.of("k", 100 + i)));
        }
        Map<String, BreakerSnapshot> before = router.getStatus().circuitBreakers();
        assertThat(before.get(FLAKY).mode()).isEqualTo(BreakerMode.OPEN);
        int callsBefore = exec.calls();

        InvocationResult hit = router.invoke(cachedReq);

        assertThat(hit.success()).isTrue();
        assertThat(hit.metadata().cached()).isTrue();
        assertThat(hit.outputs()).containsEntry("ok", true);
        assertThat(exec.calls()).isEqualTo(callsBefore);
        assertThat(router.getStatus().circuitBreakers()).isEqualTo(before);
        assertThat(router.invoke(InvocationRequest.of(FLAKY, Map.of("k", 2))).errorKind())
                .isEqualTo(InvocationErrorKind.CIRCUIT_OPEN);
    }

    @Test
    void unknownCapabilityIsCallerError() {
        InvocationOrchestrator router = open(base(priceExec));

        InvocationResult r = router.invoke(InvocationRequest.of("cap.nope", Map.of()));

        assertThat(r.success()).isFalse();
        assertThat(r.errorKind()).isEqualTo(InvocationErrorKind.CALLER_ERROR);
        assertThat(r.error()).isEqualTo("Capability not found: cap.nope");
        assertThat(router.getStatus().circuitBreakers()).isEmpty();
    }

    @Test
    void missingOrNullRequiredInputsAreListed() {
        registry.register(CapabilityDescriptor.publicCapability("cap.transfer", List.of("to", "amount", "memo")));
        ScriptedExecutor exec = ScriptedExecutor.succeeding("transfer-exec", "cap.transfer");
        InvocationOrchestrator router = open(base(exec));
        Map<String, Object> inputs = new HashMap<>();
        inputs.put("memo", "hi");
        inputs.put("amount", null);

        InvocationResult r = router.invoke(InvocationRequest.of("cap.transfer", inputs));

        assertThat(r.errorKind()).isEqualTo(InvocationErrorKind.CALLER_ERROR);
        assertThat(r.error()).isEqualTo("Missing required inputs: to, amount");
        assertThat(exec.calls()).isZero();
    }

    @Test
    void noExecutorDoesNotTripBreaker() {
        InvocationOrchestrator router = open(base(priceExec));

        for (int i = 0; i < 7; i++) {
            InvocationResult r = router.invoke(InvocationRequest.of(FLAKY, Map.of("i", i)));
            assertThat(r.errorKind()).isEqualTo(InvocationErrorKind.NO_EXECUTOR);
            assertThat(r.error()).isEqualTo("No executor available for capability: " + FLAKY);
        }
        assertThat(router.getStatus().circuitBreakers()).isEmpty();
    }

    @Test
    void breakerOpensAfterRepeatedFailuresAndRecoversAfterCooldown() {
        ScriptedExecutor flaky = new ScriptedExecutor("flaky-exec", Set.of(FLAKY),
                ctx -> ExecutionOutcome.failure("upstream unavailable", null));
        InvocationOrchestrator router = open(base(flaky));
        InvocationRequest req = InvocationRequest.of(FLAKY, Map.of());

        for (int i = 0; i < 5; i++) {
            InvocationResult r = router.invoke(req);
            assertThat(r.errorKind()).isEqualTo(InvocationErrorKind.TRANSIENT_EXECUTION);
            assertThat(r.error()).isEqualTo("Execution failed after 3 attempts: upstream unavailable");
        }
        assertThat(flaky.calls()).isEqualTo(15);

        InvocationResult rejected = router.invoke(req);
        assertThat(rejected.errorKind()).isEqualTo(InvocationErrorKind.CIRCUIT_OPEN);
        assertThat(rejected.error())
                .isEqualTo("Circuit breaker open for " + FLAKY + ". Too many failures. Retry after 30s");
        assertThat(rejected.metadata().retryAfterMs()).isEqualTo(30_000L);
        assertThat(flaky.calls()).isEqualTo(15);

        BreakerDashboard dashboard = router.getCircuitBreakerDashboard();
        assertThat(dashboard.open()).isEqualTo(1);
        assertThat(dashboard.rows()).singleElement().satisfies(row -> {
            assertThat(row.capabilityId()).isEqualTo(FLAKY);
            assertThat(row.failures()).isEqualTo(5);
        });

        clock.advance(Duration.ofSeconds(30));
        flaky.behave(ctx -> ExecutionOutcome.success(Map.of("ok", true), ExecutionMetadata.of("flaky-exec", 3)));

        assertThat(router.invoke(req).success()).isTrue();
        assertThat(router.getStatus().circuitBreakers().get(FLAKY).mode()).isEqualTo(BreakerMode.CLOSED);
        assertThat(router.getStatus().circuitBreakers().get(FLAKY).failures()).isZero();
    }

    @Test
    void callerErrorFromExecutorIsNotRetried() {
        ScriptedExecutor exec = new ScriptedExecutor("flaky-exec", Set.of(FLAKY),
                ctx -> ExecutionOutcome.failure("Pool not found", null));
        InvocationOrchestrator router = open(base(exec));

        InvocationResult r = router.invoke(InvocationRequest.of(FLAKY, Map.of()));

        assertThat(r.errorKind()).isEqualTo(InvocationErrorKind.CALLER_ERROR);
        assertThat(r.error()).isEqualTo("Pool not found");
        assertThat(exec.calls()).isEqualTo(1);
        assertThat(router.getStatus().circuitBreakers().get(FLAKY).failures()).isEqualTo(1);
    }

    @Test
    void slowExecutorTimesOut() {
        CapRouterProperties props = fastRetry();
        props.getRetry().setMaxAttempts(2);
        props.getRetry().setAttemptTimeoutMs(50);
        ScriptedExecutor slow = new ScriptedExecutor("slow-exec", Set.of(FLAKY), ctx -> {
            Thread.sleep(500);
            return ExecutionOutcome.success(Map.of(), null);
        });
        InvocationOrchestrator router = open(base(slow).properties(props));

        InvocationResult r = router.invoke(InvocationRequest.of(FLAKY, Map.of()));

        assertThat(r.errorKind()).isEqualTo(InvocationErrorKind.TIMEOUT);
        assertThat(r.error()).isEqualTo("Execution failed after 2 attempts: Attempt timed out after 50ms");
        assertThat(r.metadata().execution().attempts()).isEqualTo(2);
    }

    @Test
    void concurrentIdenticalRequestsShareOneExecution() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        ScriptedExecutor blocking = new ScriptedExecutor("price-exec", Set.of(PRICE), ctx -> {
            release.await(5, TimeUnit.SECONDS);
            return ExecutionOutcome.success(Map.of("price", 150), ExecutionMetadata.of("price-exec", 5));
        });
        InvocationOrchestrator router = open(base(blocking));
        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            CompletableFuture<InvocationResult> leader =
                    CompletableFuture.supplyAsync(() -> router.invoke(price("SOL")), callers);
            Await.until(() -> blocking.calls() == 1);
            CompletableFuture<InvocationResult> joiner =
                    CompletableFuture.supplyAsync(() -> router.invoke(price("SOL")), callers);
            Await.until(() -> router.getPerformanceStats().coalescedRequests() == 1);
            release.countDown();

            InvocationResult a = leader.get(5, TimeUnit.SECONDS);
            InvocationResult b = joiner.get(5, TimeUnit.SECONDS);
            assertThat(a.success()).isTrue();
            assertThat(b.outputs()).isEqualTo(a.outputs());
            assertThat(b.requestId()).isEqualTo(a.requestId());
            assertThat(blocking.calls()).isEqualTo(1);
            assertThat(router.getPerformanceStats().inflightRequests()).isZero();
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void deduplicatedInvokeReusesRecentResult() {
        InvocationOrchestrator router = open(base(priceExec));

        InvocationResult first = router.deduplicatedInvoke(price("SOL"), Duration.ofSeconds(2));
        InvocationResult second = router.deduplicatedInvoke(price("SOL"), Duration.ofSeconds(2));

        assertThat(first.metadata().deduplicated()).isFalse();
        assertThat(second.metadata().deduplicated()).isTrue();
        assertThat(second.requestId()).isNotEqualTo(first.requestId());
        assertThat(priceExec.calls()).isEqualTo(1);
        assertThat(router.getPerformanceStats().dedupEntries()).isEqualTo(1);
    }

    @Test
    void failuresAreNotDeduplicated() {
        InvocationOrchestrator router = open(base(priceExec));

        router.deduplicatedInvoke(InvocationRequest.of("cap.nope", Map.of()), null);
        InvocationResult again = router.deduplicatedInvoke(InvocationRequest.of("cap.nope", Map.of()), null);

        assertThat(again.metadata().deduplicated()).isFalse();
        assertThat(router.getPerformanceStats().dedupEntries()).isZero();
    }

    @Test
    void settlementSignalAttachedAndEmitterFailureTolerated() {
        InvocationOrchestrator withSignal = open(base(priceExec).settlementEmitter(new CommitmentSignalEmitter()));
        InvocationResult signed = withSignal.invoke(price("SOL"));
        assertThat(signed.metadata().settlementSignal()).isNotNull();
        assertThat(signed.metadata().settlementSignal().signalType()).isEqualTo("usage-commitment");

        InvocationOrchestrator broken = open(base(priceExec).settlementEmitter(usage -> {
            throw new IllegalStateException("network down");
        }));
        InvocationResult unsigned = broken.invoke(price("ETH"));
        assertThat(unsigned.success()).isTrue();
        assertThat(unsigned.metadata().settlementSignal()).isNull();
    }

    @Test
    void confidentialCapabilityGetsPrivacyLevelAndHints() {
        CapabilityEconomics eco = new CapabilityEconomics(0.01d, "USDC",
                new PaymentSignalConfig(true, true, List.of("solana")), true);
        registry.register(new CapabilityDescriptor("cap.mpc.v1", "MPC", "1.0.0", List.of(),
                ExecutionMode.CONFIDENTIAL, eco, false));
        ScriptedExecutor mpc = ScriptedExecutor.succeeding("mpc-exec", "cap.mpc.v1");
        List<Double> costs = new CopyOnWriteArrayList<>();
        InvocationOrchestrator router = open(base(mpc)
                .metricsCollector((capabilityId, success, latencyMs, cost) -> costs.add(cost)));

        InvocationResult r = router.invoke(InvocationRequest.of("cap.mpc.v1", Map.of()));

        assertThat(r.metadata().privacyLevel()).isEqualTo(2);
        assertThat(r.metadata().economicHints().paymentSignal().suggestedAmount()).isEqualTo(0.01d);
        assertThat(r.metadata().economicHints().privacyNote()).isNotNull();
        Await.until(() -> costs.size() == 1);
        assertThat(costs).containsExactly(0.01d);
    }

    @Test
    void healthMonitorSeesEveryExecutionAndItsFailuresAreIgnored() {
        CapabilityHealthMonitor monitor = mock(CapabilityHealthMonitor.class);
        InvocationOrchestrator router = open(base(priceExec).healthMonitor(monitor));

        router.invoke(price("SOL"));

        ArgumentCaptor<HealthEvent> captor = ArgumentCaptor.forClass(HealthEvent.class);
        verify(monitor).record(captor.capture());
        assertThat(captor.getValue().capabilityId()).isEqualTo(PRICE);
        assertThat(captor.getValue().executor()).isEqualTo("price-exec");
        assertThat(captor.getValue().success()).isTrue();

        doThrow(new IllegalStateException("monitor down")).when(monitor).record(any());
        assertThat(router.invoke(price("ETH")).success()).isTrue();
    }

    @Test
    void batchKeepsRequestOrder() {
        InvocationOrchestrator router = open(base(priceExec, swapExec));

        BatchResult batch = router.batchInvoke(List.of(
                price("SOL"),
                InvocationRequest.of(SWAP, Map.of("token", "SOL")),
                InvocationRequest.of("cap.nope", Map.of())));

        assertThat(batch.success()).isFalse();
        assertThat(batch.results()).extracting(InvocationResult::capabilityId)
                .containsExactly(PRICE, SWAP, "cap.nope");
        assertThat(batch.results()).extracting(InvocationResult::success).containsExactly(true, true, false);
        assertThat(batch.parallelismBenefitMs()).isGreaterThanOrEqualTo(0);
    }

    @Test
    void queuedInvokeCompletesThroughScheduler() throws Exception {
        InvocationOrchestrator router = open(base(priceExec));

        InvocationResult r = router.queuedInvoke(price("SOL"), Priority.HIGH).get(5, TimeUnit.SECONDS);

        assertThat(r.success()).isTrue();
        Await.until(() -> router.getQueueStats().active() == 0);
        assertThat(router.getQueueStats().queued()).isZero();
    }

    @Test
    void learnedSuccessorIsPrefetchedIntoCache() {
        PrefetchInputResolver resolver = (completed, predicted) ->
                SWAP.equals(predicted) ? Optional.of(Map.of("token", "ETH")) : Optional.empty();
        InvocationOrchestrator router = open(base(priceExec, swapExec).prefetchInputResolver(resolver));

        router.invokeWithPrefetch(price("SOL").withCaller("agent-1"));
        clock.advanceMillis(1_000);
        router.invokeWithPrefetch(InvocationRequest.of(SWAP, Map.of("token", "SOL")).withCaller("agent-1"));
        clock.advanceMillis(1_000);
        router.invokeWithPrefetch(price("SOL").withCaller("agent-1"));

        assertThat(router.getPredictedNext(PRICE, 3)).singleElement().satisfies(p -> {
            assertThat(p.capabilityId()).isEqualTo(SWAP);
            assertThat(p.probability()).isEqualTo(1.0d);
        });
        assertThat(router.isPrefetchPending(SWAP)).isTrue();

        Await.until(() -> swapExec.calls() == 2);
        Await.until(() -> router.getPerformanceStats().cache().size() == 3);
        InvocationResult warmed = router.invoke(InvocationRequest.of(SWAP, Map.of("token", "ETH")));
        assertThat(warmed.metadata().cached()).isTrue();
        assertThat(swapExec.calls()).isEqualTo(2);

        clock.advanceMillis(1_000);
        assertThat(router.isPrefetchPending(SWAP)).isFalse();
    }

    @Test
    void maintenanceExpiresCacheAndHealthyBreakers() {
        InvocationOrchestrator router = open(base(priceExec));
        router.invoke(price("SOL"));
        assertThat(router.getStatus().circuitBreakers()).hasSize(1);

        clock.advance(Duration.ofSeconds(6));
        MaintenanceReport report = router.performMaintenance();

        assertThat(report.breakersRemoved()).isEqualTo(1);
        assertThat(report.cacheEntriesExpired()).isEqualTo(1);
        assertThat(router.getStatus().circuitBreakers()).isEmpty();
    }

    @Test
    void breakerCanBeResetManually() {
        ScriptedExecutor exec = new ScriptedExecutor("flaky-exec", Set.of(FLAKY),
                ctx -> ExecutionOutcome.failure("Market not found", null));
        InvocationOrchestrator router = open(base(exec));
        router.invoke(InvocationRequest.of(FLAKY, Map.of()));

        assertThat(router.getCircuitBreakerDashboard().rows()).hasSize(1);
        assertThat(router.resetCircuitBreaker(FLAKY)).isTrue();
        assertThat(router.resetCircuitBreaker(FLAKY)).isFalse();
        assertThat(router.getCircuitBreakerDashboard().total()).isZero();
    }

    @Test
    void statusListsExecutorsAndRegistrySize() throws Exception {
        InvocationOrchestrator router = open(base(priceExec, swapExec));

        RouterStatus status = router.getStatus();

        assertThat(status.executors()).containsExactly("price-exec", "swap-exec");
        assertThat(status.capabilitiesRegistered()).isEqualTo(3);
        assertThat(router.withBulkhead("io", 2, () -> "done")).isEqualTo("done");
        assertThat(router.getBulkheadStats()).containsKey("io");
    }
}

package ai.agentcap.router.orch.prefetch;

import ai.agentcap.router.model.InvocationRequest;
import ai.agentcap.router.model.InvocationResult;
import ai.agentcap.router.orch.cache.BoundedCache;
import ai.agentcap.router.orch.exec.BackgroundTasks;
import ai.agentcap.router.spi.PrefetchInputResolver;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Speculative follow-up after a successful invocation.
 *
 * <p>For each of the top two predicted successors above the probability threshold that is not
 * already pending, the successor is marked pending for the edge's mean gap. If the
 * {@link PrefetchInputResolver} can supply inputs, the successor is also invoked in the
 * background to warm the response cache. Nothing here blocks or fails the foreground call.</p>
 */
@Slf4j
public class Prefetcher {

    static final int CANDIDATES = 2;

    private final DependencyLearner learner;
    private final double probabilityThreshold;
    private final PrefetchInputResolver resolver;
    private final BackgroundTasks tasks;
    private final Function<InvocationRequest, InvocationResult> warmer;
    private final BoundedCache<String, Boolean> pending;

    public Prefetcher(DependencyLearner learner,
                      double probabilityThreshold,
                      int maxPending,
                      PrefetchInputResolver resolver,
                      BackgroundTasks tasks,
                      Function<InvocationRequest, InvocationResult> warmer,
                      Clock clock) {
        this.learner = learner;
        this.probabilityThreshold = probabilityThreshold;
        this.resolver = resolver == null ? PrefetchInputResolver.none() : resolver;
        this.tasks = tasks;
        this.warmer = warmer;
        this.pending = new BoundedCache<>(maxPending, clock);
    }

    /**
     * @return capability ids newly marked pending
     */
    public List<String> afterSuccess(InvocationRequest completed) {
        List<String> marked = new ArrayList<>();
        for (Prediction p : learner.predictNext(completed.capabilityId(), CANDIDATES)) {
            if (p.probability() <= probabilityThreshold || pending.containsKey(p.capabilityId())) {
                continue;
            }
            long ttl = Math.max(1L, Math.round(p.avgGapMs()));
            pending.put(p.capabilityId(), Boolean.TRUE, Duration.ofMillis(ttl));
            marked.add(p.capabilityId());
            log.debug("[prefetch] {} -> {} p={} pending {}ms",
                    completed.capabilityId(), p.capabilityId(), String.format("%.2f", p.probability()), ttl);
            warm(completed, p.capabilityId());
        }
        return marked;
    }

    private void warm(InvocationRequest completed, String successor) {
        Optional<Map<String, Object>> inputs;
        try {
            inputs = resolver.resolve(completed, successor);
        } catch (RuntimeException e) {
            log.debug("[prefetch] input resolution for {} failed: {}", successor, e.toString());
            return;
        }
        inputs.ifPresent(in -> tasks.fireAndForget("prefetch:" + successor, () -> {
            InvocationResult r = warmer.apply(
                    new InvocationRequest(successor, in, completed.preferences(), completed.callerId()));
            if (!r.success()) {
                log.debug("[prefetch] warm-up of {} failed: {}", successor, r.error());
            }
        }));
    }

    public boolean isPending(String capabilityId) {
        return pending.containsKey(capabilityId);
    }

    public long pendingCount() {
        return pending.snapshot().size();
    }

    public int evictExpired() {
        return pending.evictExpired();
    }

    public void clear() {
        pending.clear();
    }
}

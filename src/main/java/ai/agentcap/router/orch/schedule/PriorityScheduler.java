package ai.agentcap.router.orch.schedule;

import ai.agentcap.router.model.InvocationErrorKind;
import ai.agentcap.router.model.InvocationRequest;
import ai.agentcap.router.model.InvocationResult;
import ai.agentcap.router.model.Priority;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Admission queue in front of the dispatcher, bounded by a global concurrency ceiling.
 *
 * <p>Pending requests are ordered by (priority rank, enqueue time, submission sequence). A drain
 * loop dispatches while capacity remains; each completion frees a slot and drains again. There is
 * no preemption. Returned futures always complete normally: a dispatcher exception becomes an
 * {@link InvocationErrorKind#INTERNAL} result.</p>
 */
@Slf4j
public class PriorityScheduler {

    static final Comparator<QueuedRequest> ORDER = Comparator
            .comparingInt((QueuedRequest q) -> q.priority().rank())
            .thenComparingLong(QueuedRequest::enqueueTime)
            .thenComparingLong(QueuedRequest::sequence);

    /** One waiting request and the handle its caller holds. */
    public record QueuedRequest(InvocationRequest request,
                                Priority priority,
                                long enqueueTime,
                                long sequence,
                                CompletableFuture<InvocationResult> completion) {
    }

    private final Object lock = new Object();
    private final PriorityQueue<QueuedRequest> queue = new PriorityQueue<>(ORDER);
    private final AtomicLong sequence = new AtomicLong();
    private final int maxConcurrent;
    private final Function<InvocationRequest, InvocationResult> dispatcher;
    private final Executor executor;
    private final Clock clock;
    private final EscalationTable escalation;
    private int active;

    public PriorityScheduler(int maxConcurrent,
                             Function<InvocationRequest, InvocationResult> dispatcher,
                             Executor executor,
                             Clock clock,
                             EscalationTable escalation) {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be > 0: " + maxConcurrent);
        }
        this.maxConcurrent = maxConcurrent;
        this.dispatcher = dispatcher;
        this.executor = executor;
        this.clock = clock;
        this.escalation = escalation == null ? EscalationTable.defaults() : escalation;
    }

    public CompletableFuture<InvocationResult> enqueue(InvocationRequest request, Priority priority) {
        Priority p = priority == null ? Priority.NORMAL : priority;
        CompletableFuture<InvocationResult> done = new CompletableFuture<>();
        QueuedRequest q = new QueuedRequest(request, p, clock.millis(), sequence.incrementAndGet(), done);
        synchronized (lock) {
            queue.add(q);
        }
        drain();
        return done;
    }

    private void drain() {
        List<QueuedRequest> launch = new ArrayList<>();
        synchronized (lock) {
            while (active < maxConcurrent && !queue.isEmpty()) {
                launch.add(queue.poll());
                active++;
            }
        }
        for (QueuedRequest q : launch) {
            dispatch(q);
        }
    }

    private void dispatch(QueuedRequest q) {
        try {
            CompletableFuture
                    .supplyAsync(() -> dispatcher.apply(q.request()), executor)
                    .whenComplete((result, error) -> finish(q, result, error));
        } catch (RuntimeException rejected) {
            finish(q, null, rejected);
        }
    }

    private void finish(QueuedRequest q, InvocationResult result, Throwable error) {
        synchronized (lock) {
            active--;
        }
        if (error != null || result == null) {
            String msg = error == null ? "no result" : String.valueOf(error.getMessage());
            log.warn("[scheduler] dispatch of {} failed: {}", q.request().capabilityId(), msg);
            q.completion().complete(InvocationResult.failure(null, q.request().capabilityId(),
                    InvocationErrorKind.INTERNAL, "Queued invocation failed: " + msg));
        } else {
            q.completion().complete(result);
        }
        drain();
    }

    public QueueStats stats() {
        long now = clock.millis();
        Map<Priority, Integer> byPriority = new EnumMap<>(Priority.class);
        for (Priority p : Priority.values()) {
            byPriority.put(p, 0);
        }
        int candidates = 0;
        int queued;
        int running;
        synchronized (lock) {
            queued = queue.size();
            running = active;
            for (QueuedRequest q : queue) {
                byPriority.merge(q.priority(), 1, Integer::sum);
                if (escalation.escalate(q.priority(), now - q.enqueueTime()) != q.priority()) {
                    candidates++;
                }
            }
        }
        return new QueueStats(queued, running, maxConcurrent, byPriority, candidates);
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }
}

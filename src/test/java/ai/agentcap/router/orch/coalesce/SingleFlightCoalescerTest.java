package ai.agentcap.router.orch.coalesce;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SingleFlightCoalescerTest {

    @Test
    void concurrentCallersShareOneExecution() throws Exception {
        SingleFlightCoalescer<String> coalescer = new SingleFlightCoalescer<>();
        AtomicInteger executions = new AtomicInteger();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            CompletableFuture<String> first = CompletableFuture.supplyAsync(() -> coalescer.run("k", () -> {
                executions.incrementAndGet();
                started.countDown();
                await(release);
                return "value";
            }), pool);
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(coalescer.pending("k")).isNotNull();

            CompletableFuture<String> second = CompletableFuture.supplyAsync(
                    () -> coalescer.run("k", () -> {
                        executions.incrementAndGet();
                        return "other";
                    }), pool);
            waitUntil(() -> coalescer.coalescedCount() == 1);
            release.countDown();

            assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo("value");
            assertThat(second.get(5, TimeUnit.SECONDS)).isEqualTo("value");
            assertThat(executions.get()).isEqualTo(1);
            assertThat(coalescer.inflightCount()).isZero();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void keyIsReleasedAfterFailure() {
        SingleFlightCoalescer<String> coalescer = new SingleFlightCoalescer<>();
        assertThatThrownBy(() -> coalescer.run("k", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(coalescer.inflightCount()).isZero();
        assertThat(coalescer.run("k", () -> "ok")).isEqualTo("ok");
    }

    @Test
    void sequentialCallsAreNotCoalesced() {
        SingleFlightCoalescer<Integer> coalescer = new SingleFlightCoalescer<>();
        AtomicInteger n = new AtomicInteger();
        coalescer.run("k", n::incrementAndGet);
        coalescer.run("k", n::incrementAndGet);
        assertThat(n.get()).isEqualTo(2);
        assertThat(coalescer.coalescedCount()).isZero();
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000L;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertThat(condition.getAsBoolean()).isTrue();
    }
}

package ai.agentcap.router.orch.exec;

import ai.agentcap.router.orch.InvocationOrchestrator;
import ai.agentcap.router.orch.MaintenanceReport;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic {@link InvocationOrchestrator#performMaintenance()} on a single daemon thread.
 */
@Slf4j
public class MaintenanceScheduler implements AutoCloseable {

    private final InvocationOrchestrator orchestrator;
    private final long intervalMs;
    private ScheduledExecutorService timer;

    public MaintenanceScheduler(InvocationOrchestrator orchestrator, long intervalMs) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be > 0: " + intervalMs);
        }
        this.orchestrator = orchestrator;
        this.intervalMs = intervalMs;
    }

    public synchronized void start() {
        if (timer != null) {
            return;
        }
        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cap-router-maintenance");
            t.setDaemon(true);
            return t;
        });
        timer.scheduleWithFixedDelay(this::runOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[cap-router] maintenance every {}ms", intervalMs);
    }

    void runOnce() {
        try {
            MaintenanceReport report = orchestrator.performMaintenance();
            log.debug("[cap-router] maintenance sweep {}", report);
        } catch (RuntimeException e) {
            log.warn("[cap-router] maintenance sweep failed: {}", e.toString());
        }
    }

    public synchronized boolean isRunning() {
        return timer != null;
    }

    @Override
    public synchronized void close() {
        if (timer != null) {
            timer.shutdownNow();
            timer = null;
        }
    }
}

package ai.agentcap.router.spi;

/**
 * Receives one event per completed invocation. Failures of the monitor are logged and
 * never affect the invocation result.
 */
@FunctionalInterface
public interface CapabilityHealthMonitor {

    void record(HealthEvent event);

    static CapabilityHealthMonitor noop() {
        return event -> {
        };
    }
}

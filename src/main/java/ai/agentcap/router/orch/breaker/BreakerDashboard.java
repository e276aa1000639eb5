package ai.agentcap.router.orch.breaker;

import java.util.List;

/**
 * Breaker overview. {@code rows} lists open and half-open breakers plus closed ones that
 * have accumulated failures; healthy breakers are only counted.
 */
public record BreakerDashboard(int total, int open, int halfOpen, int closed, List<Row> rows) {

    public BreakerDashboard {
        rows = List.copyOf(rows);
    }

    /**
     * @param retryInMs remaining cooldown, only set for open breakers
     */
    public record Row(String capabilityId, BreakerMode mode, int failures, long lastFailureTime, Long retryInMs) {
    }
}

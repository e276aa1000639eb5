package ai.agentcap.router.orch.breaker;

/** Circuit breaker mode: CLOSED → OPEN → HALF_OPEN → CLOSED. */
public enum BreakerMode {
    CLOSED, OPEN, HALF_OPEN
}

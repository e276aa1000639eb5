package ai.agentcap.router.orch.breaker;

/**
 * Mutable per-capability breaker state. All access goes through the owning
 * {@link CircuitBreakerBank}, synchronized on the instance.
 */
final class BreakerState {

    int failures;
    long lastFailureTime;
    BreakerMode mode = BreakerMode.CLOSED;

    /** Set while the single half-open trial call is outstanding. */
    boolean trialInFlight;

    BreakerSnapshot snapshot() {
        return new BreakerSnapshot(mode, failures, lastFailureTime);
    }
}

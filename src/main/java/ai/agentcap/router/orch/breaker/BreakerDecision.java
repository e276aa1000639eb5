package ai.agentcap.router.orch.breaker;

/**
 * Outcome of {@link CircuitBreakerBank#checkAllowed(String)}.
 *
 * @param allowed      whether the call may be dispatched
 * @param reason       rejection message, null when allowed
 * @param retryAfterMs remaining cooldown for a rejected call, null when allowed
 */
public record BreakerDecision(boolean allowed, String reason, Long retryAfterMs) {

    private static final BreakerDecision ALLOW = new BreakerDecision(true, null, null);

    public static BreakerDecision allow() {
        return ALLOW;
    }

    public static BreakerDecision reject(String reason, long retryAfterMs) {
        return new BreakerDecision(false, reason, retryAfterMs);
    }
}

package ai.agentcap.router.model;

/**
 * Error taxonomy carried on failed {@link InvocationResult}s. Errors are never thrown
 * across the router boundary, so batch and queued callers branch on this instead.
 */
public enum InvocationErrorKind {

    /** Unknown capability or missing required input. Never retried. */
    CALLER_ERROR,

    /** Executor failure that exhausted its retries. */
    TRANSIENT_EXECUTION,

    /** Last attempt exceeded its deadline. */
    TIMEOUT,

    /** Rejected by the circuit breaker before dispatch. */
    CIRCUIT_OPEN,

    /** Rejected by the policy router; the message lists every violated constraint. */
    POLICY_VIOLATION,

    /** No registered executor accepts the capability. */
    NO_EXECUTOR,

    /** Unexpected failure inside the router itself. */
    INTERNAL
}

package ai.agentcap.router.model;

/** How a capability is executed. Confidential capabilities run behind a privacy provider. */
public enum ExecutionMode {
    PUBLIC,
    CONFIDENTIAL
}

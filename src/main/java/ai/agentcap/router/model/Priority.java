package ai.agentcap.router.model;

/**
 * Admission priority for queued invocations. Lower {@link #rank()} dispatches first.
 */
public enum Priority {
    CRITICAL(0),
    HIGH(1),
    NORMAL(2),
    LOW(3);

    private final int rank;

    Priority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }
}

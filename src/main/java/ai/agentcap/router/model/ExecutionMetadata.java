package ai.agentcap.router.model;

import lombok.Builder;

/**
 * Execution statistics reported by an executor and completed by the retry engine.
 */
@Builder(toBuilder = true)
public record ExecutionMetadata(String executor,
                                long executionTimeMs,
                                Double costActual,
                                Double costEstimate,
                                String currency,
                                String providerUsed,
                                Integer privacyLevel,
                                int attempts,
                                String note) {

    public static ExecutionMetadata none() {
        return ExecutionMetadata.builder().executor("none").build();
    }

    public static ExecutionMetadata of(String executor, long executionTimeMs) {
        return ExecutionMetadata.builder().executor(executor).executionTimeMs(executionTimeMs).build();
    }

    public double costOrZero() {
        return costActual == null ? 0d : costActual;
    }
}

package ai.agentcap.router.orch;

import ai.agentcap.router.model.InvocationResult;

import java.util.List;

/**
 * @param success              every request succeeded
 * @param parallelismBenefitMs summed execution time minus wall-clock time, never negative
 */
public record BatchResult(boolean success, List<InvocationResult> results, long totalTimeMs, long parallelismBenefitMs) {

    public BatchResult {
        results = List.copyOf(results);
    }
}

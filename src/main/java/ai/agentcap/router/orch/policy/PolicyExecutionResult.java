package ai.agentcap.router.orch.policy;

import ai.agentcap.router.model.InvocationErrorKind;
import ai.agentcap.router.model.InvocationResult;

import java.util.List;

/**
 * @param invocation the orchestrator result of the executed route, null when nothing was executed
 * @param route      the route used, null when none was selected
 */
public record PolicyExecutionResult(boolean success,
                                    InvocationResult invocation,
                                    Route route,
                                    ComplianceProof proof,
                                    List<String> warnings,
                                    String error,
                                    InvocationErrorKind errorKind,
                                    long executionTimeMs) {

    public PolicyExecutionResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public List<String> pluginsUsed() {
        return route == null ? List.of() : route.plugins();
    }
}

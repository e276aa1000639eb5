package ai.agentcap.router.model;

import java.util.Map;

/**
 * Everything an executor receives for one attempt.
 */
public record ExecutionContext(String capabilityId,
                               Map<String, Object> inputs,
                               ExecutionPreferences preferences,
                               String requestId,
                               long timestamp) {

    public static ExecutionContext forRequest(InvocationRequest request, String requestId, long timestamp) {
        return new ExecutionContext(request.capabilityId(), request.inputs(), request.preferences(),
                requestId, timestamp);
    }
}

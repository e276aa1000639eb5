package ai.agentcap.router.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable outcome of one invocation. Failed results carry an {@link InvocationErrorKind}
 * and a human-readable error; successful ones carry outputs.
 */
public record InvocationResult(boolean success,
                               String requestId,
                               String capabilityId,
                               Map<String, Object> outputs,
                               String error,
                               InvocationErrorKind errorKind,
                               InvocationMetadata metadata) {

    public InvocationResult {
        outputs = outputs == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        metadata = metadata == null ? InvocationMetadata.empty() : metadata;
    }

    public static InvocationResult failure(String requestId,
                                           String capabilityId,
                                           InvocationErrorKind kind,
                                           String error) {
        return new InvocationResult(false, requestId, capabilityId, null, error, kind, InvocationMetadata.empty());
    }

    public InvocationResult withRequestId(String replacement) {
        return new InvocationResult(success, replacement, capabilityId, outputs, error, errorKind, metadata);
    }

    public InvocationResult withMetadata(InvocationMetadata replacement) {
        return new InvocationResult(success, requestId, capabilityId, outputs, error, errorKind, replacement);
    }
}

package ai.agentcap.router.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one executor call (or of the retry engine wrapping several).
 */
public record ExecutionOutcome(boolean success,
                               Map<String, Object> outputs,
                               String error,
                               ExecutionMetadata metadata) {

    public ExecutionOutcome {
        outputs = outputs == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        metadata = metadata == null ? ExecutionMetadata.none() : metadata;
    }

    public static ExecutionOutcome success(Map<String, Object> outputs, ExecutionMetadata metadata) {
        return new ExecutionOutcome(true, outputs, null, metadata);
    }

    public static ExecutionOutcome failure(String error, ExecutionMetadata metadata) {
        return new ExecutionOutcome(false, null, error, metadata);
    }

    public ExecutionOutcome withMetadata(ExecutionMetadata replacement) {
        return new ExecutionOutcome(success, outputs, error, replacement);
    }
}

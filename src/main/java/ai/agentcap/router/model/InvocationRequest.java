package ai.agentcap.router.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One capability invocation as submitted by a caller. Immutable once built;
 * the input map keeps the caller's insertion order.
 *
 * @param capabilityId target capability id
 * @param inputs       ordered key/value inputs
 * @param preferences  optional execution preferences, passed through to executors
 * @param callerId     optional caller identity, used to attribute capability sequences
 */
public record InvocationRequest(String capabilityId,
                                Map<String, Object> inputs,
                                ExecutionPreferences preferences,
                                String callerId) {

    public static final String ANONYMOUS_CALLER = "anonymous";

    public InvocationRequest {
        Objects.requireNonNull(capabilityId, "capabilityId");
        inputs = (inputs == null || inputs.isEmpty())
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    }

    public static InvocationRequest of(String capabilityId, Map<String, Object> inputs) {
        return new InvocationRequest(capabilityId, inputs, null, null);
    }

    public InvocationRequest withCaller(String caller) {
        return new InvocationRequest(capabilityId, inputs, preferences, caller);
    }

    public InvocationRequest withPreferences(ExecutionPreferences prefs) {
        return new InvocationRequest(capabilityId, inputs, prefs, callerId);
    }

    public String callerOrAnonymous() {
        return (callerId == null || callerId.isBlank()) ? ANONYMOUS_CALLER : callerId;
    }
}

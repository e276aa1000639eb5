package ai.agentcap.router.model;

import java.util.List;
import java.util.Objects;

/**
 * The slice of a capability's registry entry the router needs: identity, required
 * inputs, execution mode and economics.
 */
public record CapabilityDescriptor(String id,
                                   String name,
                                   String version,
                                   List<String> requiredInputs,
                                   ExecutionMode executionMode,
                                   CapabilityEconomics economics,
                                   boolean deprecated) {

    public CapabilityDescriptor {
        Objects.requireNonNull(id, "id");
        requiredInputs = requiredInputs == null ? List.of() : List.copyOf(requiredInputs);
        executionMode = executionMode == null ? ExecutionMode.PUBLIC : executionMode;
        economics = economics == null ? CapabilityEconomics.free() : economics;
    }

    public static CapabilityDescriptor publicCapability(String id, List<String> requiredInputs) {
        return new CapabilityDescriptor(id, id, "1.0.0", requiredInputs, ExecutionMode.PUBLIC,
                CapabilityEconomics.free(), false);
    }

    public boolean confidential() {
        return executionMode == ExecutionMode.CONFIDENTIAL;
    }
}

package ai.agentcap.router.spi;

import ai.agentcap.router.model.CapabilityDescriptor;

import java.util.Optional;

/**
 * Read-only view over the capability catalogue.
 */
public interface CapabilityRegistry {

    Optional<CapabilityDescriptor> getCapability(String capabilityId);

    int capabilityCount();
}

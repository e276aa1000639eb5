package ai.agentcap.router.spi;

import ai.agentcap.router.model.CapabilityDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed registry. Used as the default bean and in tests.
 */
@Slf4j
public class InMemoryCapabilityRegistry implements CapabilityRegistry {

    private final Map<String, CapabilityDescriptor> capabilities = new ConcurrentHashMap<>();

    public InMemoryCapabilityRegistry() {
    }

    public InMemoryCapabilityRegistry(Collection<CapabilityDescriptor> initial) {
        if (initial != null) {
            initial.forEach(this::register);
        }
    }

    public InMemoryCapabilityRegistry register(CapabilityDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        CapabilityDescriptor prev = capabilities.putIfAbsent(descriptor.id(), descriptor);
        if (prev != null) {
            throw new IllegalStateException("Capability already registered: " + descriptor.id());
        }
        log.debug("[registry] registered {}", descriptor.id());
        return this;
    }

    public boolean unregister(String capabilityId) {
        return capabilityId != null && capabilities.remove(capabilityId) != null;
    }

    @Override
    public Optional<CapabilityDescriptor> getCapability(String capabilityId) {
        if (capabilityId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(capabilities.get(capabilityId));
    }

    @Override
    public int capabilityCount() {
        return capabilities.size();
    }

    public List<CapabilityDescriptor> all() {
        return List.copyOf(capabilities.values());
    }
}

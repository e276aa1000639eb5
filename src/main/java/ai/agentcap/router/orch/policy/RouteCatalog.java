package ai.agentcap.router.orch.policy;

import java.util.List;

/**
 * Candidate routes per capability type (swap, price, ...).
 */
@FunctionalInterface
public interface RouteCatalog {

    List<Route> candidates(String capabilityType);
}

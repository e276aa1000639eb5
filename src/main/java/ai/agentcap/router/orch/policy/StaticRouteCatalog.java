package ai.agentcap.router.orch.policy;

import java.util.List;
import java.util.Map;

/**
 * Built-in routes: public and MPC-private swap, and public price lookup.
 */
public class StaticRouteCatalog implements RouteCatalog {

    private static final Map<String, List<Route>> ROUTES = Map.of(
            "swap", List.of(
                    new Route("jupiter", "cap.swap.execute.v1", List.of("dex"), PrivacyTier.NONE, 0.001d, 500L, Map.of()),
                    new Route("private-swap", "cap.arcium.mpc.v1", List.of("privacy", "dex"), PrivacyTier.HIGH, 0.005d, 2_000L, Map.of())),
            "price", List.of(
                    new Route("public-price", "cap.price.lookup.v1", List.of("oracle"), PrivacyTier.NONE, 0.0001d, 200L, Map.of())));

    @Override
    public List<Route> candidates(String capabilityType) {
        return capabilityType == null ? List.of() : ROUTES.getOrDefault(capabilityType, List.of());
    }
}

package ai.agentcap.router.orch.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ProofStep(String step, boolean passed, Map<String, Object> details) {

    public static final String POLICY_VALIDATION = "policy_validation";
    public static final String ROUTE_SELECTION = "route_selection";
    public static final String FALLBACK_ROUTE = "fallback_route";
    public static final String EXECUTION = "execution";

    public ProofStep {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    Map<String, Object> canonicalForm() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("step", step);
        m.put("passed", passed);
        m.put("details", details);
        return m;
    }
}

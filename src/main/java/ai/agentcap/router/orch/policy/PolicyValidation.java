package ai.agentcap.router.orch.policy;

import java.util.List;

public record PolicyValidation(boolean valid, List<String> violations, List<String> warnings) {

    public PolicyValidation {
        violations = List.copyOf(violations);
        warnings = List.copyOf(warnings);
    }

    static PolicyValidation ok() {
        return new PolicyValidation(true, List.of(), List.of());
    }
}

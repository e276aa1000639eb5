package ai.agentcap.router.orch.policy;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Binding execution policies per agent, and the check of declared parameters against them.
 */
@Slf4j
public class PolicyRegistry {

    private final ConcurrentHashMap<String, ExecutionPolicy> policies = new ConcurrentHashMap<>();

    public void register(String agentId, ExecutionPolicy policy) {
        policies.put(Objects.requireNonNull(agentId, "agentId"), Objects.requireNonNull(policy, "policy"));
        log.debug("[policy] registered policy for {}", agentId);
    }

    public Optional<ExecutionPolicy> get(String agentId) {
        return agentId == null ? Optional.empty() : Optional.ofNullable(policies.get(agentId));
    }

    public boolean remove(String agentId) {
        return agentId != null && policies.remove(agentId) != null;
    }

    /**
     * Validates what a caller proposes against the agent's registered policy. An agent without a
     * registered policy is always valid.
     *
     * @param declared     the caller's declared privacy tier, cost, slippage and latency
     * @param slippage     proposed slippage, overrides {@code declared.maxSlippage()} when set
     * @param counterparty proposed counterparty, may be null
     */
    public PolicyValidation validate(String agentId, ExecutionPolicy declared, Double slippage, String counterparty) {
        Optional<ExecutionPolicy> registered = get(agentId);
        if (registered.isEmpty()) {
            return PolicyValidation.ok();
        }
        ExecutionPolicy policy = registered.get();
        ExecutionPolicy d = declared == null ? ExecutionPolicy.unrestricted() : declared;
        List<String> violations = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (policy.privacyFloor() != null && d.privacyFloor() != null && !d.privacyFloor().atLeast(policy.privacyFloor())) {
            violations.add("Privacy level " + d.privacyFloor().label() + " below required " + policy.privacyFloor().label());
        }

        if (policy.maxCost() != null && d.maxCost() != null) {
            if (d.maxCost() > policy.maxCost()) {
                violations.add("Estimated cost " + d.maxCost() + " exceeds budget " + policy.maxCost());
            } else if (d.maxCost() > policy.maxCost() * 0.8d) {
                warnings.add("Cost approaching budget limit (" + Math.round(d.maxCost() / policy.maxCost() * 100) + "%)");
            }
        }

        Double proposedSlippage = slippage != null ? slippage : d.maxSlippage();
        if (policy.maxSlippage() != null && proposedSlippage != null && proposedSlippage > policy.maxSlippage()) {
            violations.add("Slippage " + proposedSlippage + "% exceeds max " + policy.maxSlippage() + "%");
        }

        if (counterparty != null) {
            if (policy.blockedCounterparties().contains(counterparty)) {
                violations.add("Counterparty " + counterparty + " is blocked");
            }
            if (!policy.trustedCounterparties().isEmpty() && !policy.trustedCounterparties().contains(counterparty)) {
                warnings.add("Counterparty " + counterparty + " not in trusted list");
            }
        }

        if (policy.maxLatencyMs() != null && d.maxLatencyMs() != null && d.maxLatencyMs() > policy.maxLatencyMs()) {
            warnings.add("Estimated latency " + d.maxLatencyMs() + "ms exceeds preference " + policy.maxLatencyMs() + "ms");
        }

        return new PolicyValidation(violations.isEmpty(), violations, warnings);
    }
}

package ai.agentcap.router.orch.policy;

import ai.agentcap.router.model.InvocationErrorKind;
import ai.agentcap.router.model.InvocationRequest;
import ai.agentcap.router.model.InvocationResult;
import ai.agentcap.router.orch.InvocationOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Executes a capability type under an agent's execution policy and records each decision as a
 * {@link ProofStep}:
 * <ol>
 *   <li>{@code policy_validation}: declared parameters against the registered policy; a failure
 *       stops here with every violation listed</li>
 *   <li>{@code route_selection}: cheapest candidate route that passes the declared filters</li>
 *   <li>{@code fallback_route}: only when no route passed and fallbacks are allowed, one retry
 *       with cost ×1.5 and latency ×2</li>
 *   <li>{@code execution}: the chosen route through the orchestrator</li>
 * </ol>
 */
@Slf4j
@RequiredArgsConstructor
public class PolicyRouter {

    private final InvocationOrchestrator orchestrator;
    private final PolicyRegistry policies;
    private final RouteCatalog routes;
    private final Clock clock;

    public PolicyExecutionResult executeWithPolicy(PolicyExecutionRequest request) {
        long start = clock.millis();
        List<ProofStep> steps = new ArrayList<>();
        ExecutionPolicy declared = request.policy();

        PolicyValidation validation = policies.validate(request.agentId(), declared, request.slippage(),
                request.counterparty());
        Map<String, Object> vDetails = new LinkedHashMap<>();
        vDetails.put("valid", validation.valid());
        vDetails.put("violations", validation.violations());
        vDetails.put("warnings", validation.warnings());
        steps.add(new ProofStep(ProofStep.POLICY_VALIDATION, validation.valid(), vDetails));

        if (!validation.valid()) {
            log.info("[policy] {} rejected for {}: {}", request.capabilityType(), request.agentId(), validation.violations());
            return new PolicyExecutionResult(false, null, null, ComplianceProof.of(steps, clock.millis()),
                    validation.warnings(), "Policy violations: " + String.join(", ", validation.violations()),
                    InvocationErrorKind.POLICY_VIOLATION, clock.millis() - start);
        }

        Optional<Route> route = select(request.capabilityType(), declared);
        steps.add(new ProofStep(ProofStep.ROUTE_SELECTION, route.isPresent(),
                route.map(Route::describe).orElseGet(Map::of)));

        if (route.isEmpty() && request.fallbacksAllowed()) {
            ExecutionPolicy relaxed = declared.relaxed();
            route = select(request.capabilityType(), relaxed);
            Map<String, Object> fDetails = new LinkedHashMap<>();
            fDetails.put("relaxed_max_cost", relaxed.maxCost());
            fDetails.put("relaxed_max_latency_ms", relaxed.maxLatencyMs());
            route.ifPresent(r -> fDetails.put("route", r.describe()));
            steps.add(new ProofStep(ProofStep.FALLBACK_ROUTE, route.isPresent(), fDetails));
            route.ifPresent(r -> log.debug("[policy] {} fell back to route {}", request.capabilityType(), r.id()));
        }

        if (route.isEmpty()) {
            return new PolicyExecutionResult(false, null, null, ComplianceProof.of(steps, clock.millis()),
                    validation.warnings(), "No compliant route found for " + request.capabilityType(),
                    InvocationErrorKind.POLICY_VIOLATION, clock.millis() - start);
        }

        Route chosen = route.get();
        Map<String, Object> inputs = new LinkedHashMap<>(request.inputs());
        inputs.putAll(chosen.params());
        InvocationResult result = orchestrator.invoke(
                new InvocationRequest(chosen.capabilityId(), inputs, null, request.agentId()));

        Map<String, Object> eDetails = new LinkedHashMap<>();
        eDetails.put("route", chosen.id());
        eDetails.put("capability_id", chosen.capabilityId());
        eDetails.put("success", result.success());
        if (!result.success()) {
            eDetails.put("error", result.error());
        }
        steps.add(new ProofStep(ProofStep.EXECUTION, result.success(), eDetails));

        return new PolicyExecutionResult(result.success(), result, chosen, ComplianceProof.of(steps, clock.millis()),
                validation.warnings(), result.error(), result.errorKind(), clock.millis() - start);
    }

    /**
     * Cheapest candidate for {@code capabilityType} passing the privacy floor, cost and latency
     * ceilings, exclusions and, when any are named, the preferred routes.
     */
    Optional<Route> select(String capabilityType, ExecutionPolicy policy) {
        return routes.candidates(capabilityType).stream()
                .filter(r -> r.privacyTier().atLeast(policy.privacyFloor()))
                .filter(r -> policy.maxCost() == null || r.estimatedCost() <= policy.maxCost())
                .filter(r -> policy.maxLatencyMs() == null || r.estimatedLatencyMs() <= policy.maxLatencyMs())
                .filter(r -> !policy.excludedRoutes().contains(r.id()))
                .filter(r -> policy.preferredRoutes().isEmpty() || policy.preferredRoutes().contains(r.id()))
                .min(Comparator.comparingDouble(Route::estimatedCost));
    }
}

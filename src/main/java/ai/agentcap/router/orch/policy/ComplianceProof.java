package ai.agentcap.router.orch.policy;

import ai.agentcap.router.orch.trace.CapDigest;

import java.util.List;

/**
 * Replayable record of a policy-routed execution. {@code digest} covers the ordered steps only
 * (not the timestamp), so replaying the same decisions yields the same digest.
 */
public record ComplianceProof(String version, long timestamp, List<ProofStep> steps, boolean allPassed, String digest) {

    public static final String VERSION = "1.0";

    public ComplianceProof {
        steps = List.copyOf(steps);
    }

    public static ComplianceProof of(List<ProofStep> steps, long timestamp) {
        boolean allPassed = steps.stream().allMatch(ProofStep::passed);
        return new ComplianceProof(VERSION, timestamp, steps, allPassed, digest(steps));
    }

    public static String digest(List<ProofStep> steps) {
        return CapDigest.sha256Canonical(steps.stream().map(ProofStep::canonicalForm).toList());
    }

    /** True when {@link #digest()} matches the steps it claims to cover. */
    public boolean verify() {
        return digest(steps).equals(digest);
    }
}

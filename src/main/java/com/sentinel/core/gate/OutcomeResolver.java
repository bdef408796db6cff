package com.sentinel.core.gate;

import com.sentinel.core.policy.EnforcementMode;

import java.util.List;
import java.util.Optional;

/**
 * Aggregates per-policy results into one gate outcome.
 * <ul>
 *   <li>any {@link PolicyResultStatus#ERROR}: BLOCK in blocking mode, WARNING in monitoring mode</li>
 *   <li>require-all-pass: any FAIL gives BLOCK, else any REVIEW gives WARNING, else ALLOW</li>
 *   <li>otherwise the most permissive applicable result wins (PASS over REVIEW over FAIL);
 *       no applicable policy gives ALLOW</li>
 *   <li>monitoring mode reports a policy BLOCK as WARNING</li>
 * </ul>
 */
public final class OutcomeResolver {

    private OutcomeResolver() {}

    public record Resolution(GateOutcome outcome, String reason) {}

    public static Resolution resolve(List<PolicyResult> results, boolean requireAllPass, EnforcementMode mode) {
        Optional<PolicyResult> error = first(results, PolicyResultStatus.ERROR);
        if (error.isPresent()) {
            GateOutcome conservative = mode == EnforcementMode.MONITORING ? GateOutcome.WARNING : GateOutcome.BLOCK;
            return new Resolution(conservative,
                    "Policy " + error.get().policyKey() + " could not be evaluated: " + error.get().detail());
        }

        Resolution resolution = requireAllPass ? allMustPass(results) : mostPermissive(results);
        if (mode == EnforcementMode.MONITORING && resolution.outcome() == GateOutcome.BLOCK) {
            return new Resolution(GateOutcome.WARNING, resolution.reason() + " (monitoring only)");
        }
        return resolution;
    }

    private static Resolution allMustPass(List<PolicyResult> results) {
        Optional<PolicyResult> fail = first(results, PolicyResultStatus.FAIL);
        if (fail.isPresent()) {
            return new Resolution(GateOutcome.BLOCK, describe("Denied", fail.get()));
        }
        Optional<PolicyResult> review = first(results, PolicyResultStatus.REVIEW);
        if (review.isPresent()) {
            return new Resolution(GateOutcome.WARNING, describe("Review required", review.get()));
        }
        return new Resolution(GateOutcome.ALLOW, allowReason(results));
    }

    private static Resolution mostPermissive(List<PolicyResult> results) {
        Optional<PolicyResult> pass = first(results, PolicyResultStatus.PASS);
        if (pass.isPresent()) {
            return new Resolution(GateOutcome.ALLOW, describe("Allowed", pass.get()));
        }
        Optional<PolicyResult> review = first(results, PolicyResultStatus.REVIEW);
        if (review.isPresent()) {
            return new Resolution(GateOutcome.WARNING, describe("Review required", review.get()));
        }
        Optional<PolicyResult> fail = first(results, PolicyResultStatus.FAIL);
        if (fail.isPresent()) {
            return new Resolution(GateOutcome.BLOCK, describe("Denied", fail.get()));
        }
        return new Resolution(GateOutcome.ALLOW, "No applicable policy");
    }

    private static String allowReason(List<PolicyResult> results) {
        long passed = results.stream().filter(r -> r.status() == PolicyResultStatus.PASS).count();
        return passed == 0 ? "No applicable policy" : "All " + passed + " applicable policies passed";
    }

    private static String describe(String verb, PolicyResult result) {
        String how = result.autoDenied() ? " (auto-deny)" : "";
        return verb + " by policy " + result.policyKey() + how + " at priority " + result.priority();
    }

    private static Optional<PolicyResult> first(List<PolicyResult> results, PolicyResultStatus status) {
        return results.stream().filter(r -> r.status() == status).findFirst();
    }
}

package com.sentinel.core.gate;

import com.sentinel.core.error.PolicyEvaluationException;
import com.sentinel.core.policy.Condition;
import com.sentinel.core.policy.ConditionParser;
import com.sentinel.core.policy.ControlPolicy;
import com.sentinel.core.policy.PolicyAction;

import java.util.Map;

/**
 * Evaluates a single control policy against a request context. Pure; never throws.
 */
public final class PolicyEvaluator {

    private PolicyEvaluator() {}

    public static PolicyResult evaluate(ControlPolicy policy, Map<String, ?> context) {
        Condition autoDeny;
        Condition applies;
        try {
            autoDeny = ConditionParser.compileTriggers(policy.autoDenyConditions());
            applies = ConditionParser.compile(policy.conditions());
        } catch (PolicyEvaluationException e) {
            return result(policy, PolicyResultStatus.ERROR, false, "Malformed condition: " + e.getMessage());
        }

        try {
            if (autoDeny.matches(context)) {
                return result(policy, PolicyResultStatus.FAIL, true, "Auto-deny condition matched");
            }
            if (!applies.matches(context)) {
                return result(policy, PolicyResultStatus.NOT_APPLICABLE, false, "Conditions not met");
            }
        } catch (RuntimeException e) {
            return result(policy, PolicyResultStatus.ERROR, false, "Condition evaluation failed: " + e.getMessage());
        }

        PolicyAction action = policy.action();
        return switch (action) {
            case ALLOW -> result(policy, PolicyResultStatus.PASS, false, "Allowed");
            case DENY -> result(policy, PolicyResultStatus.FAIL, false, "Denied");
            case REVIEW -> result(policy, PolicyResultStatus.REVIEW, false, "Review required");
        };
    }

    private static PolicyResult result(ControlPolicy policy, PolicyResultStatus status, boolean autoDenied,
                                       String detail) {
        return new PolicyResult(policy.id(), policy.key(), policy.priority(), policy.action(),
                status, autoDenied, detail);
    }
}

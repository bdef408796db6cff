package com.sentinel.core.gate;

import com.sentinel.core.policy.PolicyAction;

/**
 * Result of evaluating one control policy at a gate.
 *
 * @param policyId   evaluated policy
 * @param policyKey  policy key
 * @param priority   policy priority at evaluation time
 * @param action     the policy's configured recommendation
 * @param status     what the policy contributed
 * @param autoDenied true when an auto-deny trigger matched
 * @param detail     explanation, or the error message for {@link PolicyResultStatus#ERROR}
 */
public record PolicyResult(
    String policyId,
    String policyKey,
    int priority,
    PolicyAction action,
    PolicyResultStatus status,
    boolean autoDenied,
    String detail
) {}

package com.sentinel.core.policy;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Named checkpoint where kill switches and control policies are evaluated.
 *
 * @param id                identity
 * @param key               lookup key used by callers
 * @param name              display name
 * @param type              checkpoint kind
 * @param policyIds         control policies evaluated at this gate
 * @param mode              blocking or monitoring
 * @param requireAllPass    all applicable policies must pass (otherwise the most permissive wins)
 * @param checkKillSwitches consult kill switches before policies
 * @param captureInputs     record request inputs as evidence
 * @param captureOutputs    record request outputs as evidence
 * @param captureContext    record the evaluation context as evidence
 * @param scope             workflow/capability the gate guards (global when unscoped)
 * @param timeout           per-gate evaluation timeout (nullable, falls back to the configured default)
 * @param active            inactive gates fail closed
 */
public record EnforcementGate(
    String id,
    String key,
    String name,
    GateType type,
    List<String> policyIds,
    EnforcementMode mode,
    boolean requireAllPass,
    boolean checkKillSwitches,
    boolean captureInputs,
    boolean captureOutputs,
    boolean captureContext,
    Scope scope,
    Duration timeout,
    boolean active
) {

    public EnforcementGate {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(type, "type must not be null");
        policyIds = policyIds == null ? List.of() : List.copyOf(policyIds);
        mode = mode == null ? EnforcementMode.BLOCKING : mode;
        scope = scope == null ? Scope.GLOBAL : scope;
    }
}

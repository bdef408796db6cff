package com.sentinel.core.policy;

import java.util.List;
import java.util.Optional;

/**
 * Read-only snapshot of governance configuration consumed by the gate evaluator.
 * <p>
 * Implementations throw {@link com.sentinel.core.error.PolicySourceUnavailableException}
 * for transient failures; callers retry those with backoff.
 */
public interface PolicySource {

    Optional<EnforcementGate> gate(String gateKey);

    /**
     * Active kill switches whose scope covers {@code scope}.
     */
    List<KillSwitch> activeKillSwitches(Scope scope);

    /**
     * Active control policies attached to the gate, in evaluation order
     * (ascending priority, ties by id).
     */
    List<ControlPolicy> activePolicies(String gateId);
}

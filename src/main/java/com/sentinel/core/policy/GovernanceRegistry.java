package com.sentinel.core.policy;

import java.util.List;
import java.util.Optional;

/**
 * Writable side of the governance configuration, used by the kill switch and
 * control policy services. The gate evaluator only sees {@link PolicySource}.
 */
public interface GovernanceRegistry extends PolicySource {

    List<EnforcementGate> gates();

    List<KillSwitch> killSwitches();

    Optional<KillSwitch> killSwitch(String key);

    Optional<ControlPolicy> policy(String policyId);

    void saveGate(EnforcementGate gate);

    void saveKillSwitch(KillSwitch killSwitch);

    void savePolicy(ControlPolicy policy);
}

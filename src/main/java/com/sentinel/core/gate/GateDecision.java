package com.sentinel.core.gate;

import com.sentinel.core.policy.EnforcementMode;

import java.util.UUID;

/**
 * Terminal answer returned to the caller of a gate.
 *
 * @param outcome         the decision
 * @param gateExecutionId the recorded {@link GateExecution}
 * @param ledgerEventId   the ledger event recording the decision (null if it could not be written)
 * @param reason          human-readable explanation
 * @param enforcementMode mode of the evaluated gate (null when the gate was unknown)
 */
public record GateDecision(
    GateOutcome outcome,
    UUID gateExecutionId,
    UUID ledgerEventId,
    String reason,
    EnforcementMode enforcementMode
) {

    /**
     * ALLOW, or WARNING from a gate in monitoring mode.
     */
    public boolean permitsExecution() {
        return outcome == GateOutcome.ALLOW
                || (outcome == GateOutcome.WARNING && enforcementMode == EnforcementMode.MONITORING);
    }
}

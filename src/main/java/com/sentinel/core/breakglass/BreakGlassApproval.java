package com.sentinel.core.breakglass;

import com.sentinel.core.gate.GateDecision;

/**
 * Result of an approval attempt.
 *
 * @param grant    the grant afterwards (APPROVED, or still PENDING when the entry gate refused)
 * @param decision the break-glass entry gate decision
 */
public record BreakGlassApproval(BreakGlassGrant grant, GateDecision decision) {

    public boolean approved() {
        return grant.getStatus() == BreakGlassStatus.APPROVED;
    }
}

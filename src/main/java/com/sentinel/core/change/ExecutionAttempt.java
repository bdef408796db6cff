package com.sentinel.core.change;

import com.sentinel.core.gate.GateDecision;

/**
 * Result of {@link ChangeRequestService#beginExecution}.
 *
 * @param request  the request after the attempt (IN_PROGRESS, or back at APPROVED when blocked)
 * @param decision the production-change gate decision
 */
public record ExecutionAttempt(ChangeRequest request, GateDecision decision) {

    public boolean started() {
        return request.getStatus() == ChangeStatus.IN_PROGRESS;
    }
}

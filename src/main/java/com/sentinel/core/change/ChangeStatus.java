package com.sentinel.core.change;

/**
 * Lifecycle states of a change request.
 */
public enum ChangeStatus {
    DRAFT,
    SUBMITTED,
    UNDER_REVIEW,
    PENDING_APPROVAL,
    APPROVED,
    SCHEDULED,
    IN_PROGRESS,
    PENDING_VERIFICATION,
    COMPLETED,
    FAILED,
    ROLLED_BACK,
    REJECTED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ROLLED_BACK || this == REJECTED || this == CANCELLED;
    }

    /** States from which a request may still be rejected or cancelled. */
    public boolean isPreApproval() {
        return this == DRAFT || this == SUBMITTED || this == UNDER_REVIEW || this == PENDING_APPROVAL;
    }
}

package com.sentinel.core.ledger;

public enum AuditEventType {
    // Gates
    GATE_EXECUTED,
    GATE_BLOCKED,

    // Kill switches and policies
    KILL_SWITCH_REGISTERED,
    KILL_SWITCH_ACTIVATED,
    KILL_SWITCH_DEACTIVATED,
    POLICY_REGISTERED,
    POLICY_DEACTIVATED,

    // Change requests
    CHANGE_REQUEST_CREATED,
    CHANGE_REQUEST_UPDATED,
    CHANGE_REQUEST_SUBMITTED,
    CHANGE_REQUEST_AUTO_APPROVED,
    CHANGE_REQUEST_REVIEW_STARTED,
    CHANGE_REQUEST_REVIEWED,
    CHANGE_REQUEST_APPROVED,
    CHANGE_REQUEST_SCHEDULED,
    CHANGE_REQUEST_RESCHEDULED,
    CHANGE_REQUEST_REJECTED,
    CHANGE_REQUEST_CANCELLED,
    CHANGE_EXECUTION_STARTED,
    CHANGE_EXECUTION_BLOCKED,
    CHANGE_WINDOW_EXPIRED,
    CHANGE_EXECUTION_COMPLETED,
    CHANGE_EXECUTION_FAILED,
    CHANGE_VERIFIED,
    CHANGE_ROLLED_BACK,

    // Break-glass
    BREAK_GLASS_REQUESTED,
    BREAK_GLASS_APPROVED,
    BREAK_GLASS_APPROVAL_BLOCKED,
    BREAK_GLASS_DENIED,
    BREAK_GLASS_REVOKED,
    BREAK_GLASS_EXPIRED,
    BREAK_GLASS_REVIEWED
}

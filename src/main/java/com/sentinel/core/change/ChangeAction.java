package com.sentinel.core.change;

/**
 * Inputs to the change request transition table.
 */
public enum ChangeAction {
    UPDATE,
    SUBMIT,
    AUTO_APPROVE,
    BEGIN_REVIEW,
    COMPLETE_REVIEW,
    APPROVE,
    SCHEDULE,
    RESCHEDULE,
    REJECT,
    CANCEL,
    BEGIN_EXECUTION,
    BLOCK_EXECUTION,
    COMPLETE_EXECUTION,
    AWAIT_VERIFICATION,
    VERIFY,
    FAIL_EXECUTION,
    ROLLBACK
}

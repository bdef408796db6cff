package com.sentinel.core.policy;

/**
 * Kill switch modes, ordered by severity.
 */
public enum KillSwitchMode {
    HARD_STOP(4),   // halt everything, absolute
    SOFT_STOP(3),   // refuse new writes
    READ_ONLY(2),   // refuse writes, reads continue
    DEGRADE(1);     // continue in degraded mode

    private final int severity;

    KillSwitchMode(int severity) {
        this.severity = severity;
    }

    public int severity() {
        return severity;
    }
}

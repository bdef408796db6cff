package com.sentinel.core.gate;

public enum GateOutcome {
    ALLOW,
    WARNING,
    DEGRADE,
    BLOCK,
    HARD_STOP;

    /** BLOCK and HARD_STOP stop the action; they are recorded as GATE_BLOCKED. */
    public boolean isBlocking() {
        return this == BLOCK || this == HARD_STOP;
    }
}

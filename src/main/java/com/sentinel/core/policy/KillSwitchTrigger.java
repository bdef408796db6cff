package com.sentinel.core.policy;

public enum KillSwitchTrigger {
    MANUAL,
    INCIDENT,
    SECURITY,
    COMPLIANCE,
    AUTOMATED,
    DATA_ANOMALY
}

package com.sentinel.core.events;

public enum AlertSeverity {
    INFO,
    WARNING,
    CRITICAL
}

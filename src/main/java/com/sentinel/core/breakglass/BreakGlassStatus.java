package com.sentinel.core.breakglass;

public enum BreakGlassStatus {
    PENDING,
    APPROVED,
    DENIED,
    EXPIRED,
    REVOKED
}

package com.sentinel.core.breakglass;

/**
 * Accepted justifications for an emergency override.
 */
public enum BreakGlassReason {
    P0_INCIDENT,
    DATA_LOSS,
    SECURITY_RESPONSE,
    REGULATORY,
    CUSTOMER_IMPACT,
    SYSTEM_FAILURE
}

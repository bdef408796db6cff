package com.sentinel.core.gate;

public enum PolicyResultStatus {
    PASS,            // applies, recommends ALLOW
    FAIL,            // applies, recommends DENY (or auto-denied)
    REVIEW,          // applies, recommends REVIEW
    NOT_APPLICABLE,  // conditions did not match
    ERROR            // condition could not be evaluated
}

package com.sentinel.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Sentinel-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setGate(String gateKey, String executionId) {
        MDC.put("gateKey", gateKey);
        MDC.put("executionId", executionId);
    }

    public static void setChange(String changeId) {
        MDC.put("changeId", changeId);
    }

    public static void setGrant(String grantId) {
        MDC.put("grantId", grantId);
    }

    public static void clearGate() {
        MDC.remove("gateKey");
        MDC.remove("executionId");
    }

    public static void clearChange() {
        MDC.remove("changeId");
    }

    public static void clearGrant() {
        MDC.remove("grantId");
    }

    public static void clear() {
        MDC.remove("gateKey");
        MDC.remove("executionId");
        MDC.remove("changeId");
        MDC.remove("grantId");
    }
}

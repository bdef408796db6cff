package com.sentinel.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setGate puts gateKey and executionId in MDC")
    void setGate() {
        MdcContext.setGate("production-change", "exec-1");
        assertEquals("production-change", MDC.get("gateKey"));
        assertEquals("exec-1", MDC.get("executionId"));
    }

    @Test
    @DisplayName("setChange and setGrant put their ids in MDC")
    void setChangeAndGrant() {
        MdcContext.setChange("c-1");
        MdcContext.setGrant("g-1");
        assertEquals("c-1", MDC.get("changeId"));
        assertEquals("g-1", MDC.get("grantId"));
    }

    @Test
    @DisplayName("clearGate leaves the change key in place")
    void clearGateOnly() {
        MdcContext.setChange("c-1");
        MdcContext.setGate("production-change", "exec-1");
        MdcContext.clearGate();
        assertNull(MDC.get("gateKey"));
        assertNull(MDC.get("executionId"));
        assertEquals("c-1", MDC.get("changeId"));
    }

    @Test
    @DisplayName("clear removes all sentinel MDC keys")
    void clear() {
        MdcContext.setGate("production-change", "exec-1");
        MdcContext.setChange("c-1");
        MdcContext.setGrant("g-1");
        MdcContext.clear();
        assertNull(MDC.get("gateKey"));
        assertNull(MDC.get("executionId"));
        assertNull(MDC.get("changeId"));
        assertNull(MDC.get("grantId"));
    }
}

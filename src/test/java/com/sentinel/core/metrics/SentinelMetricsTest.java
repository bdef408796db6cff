package com.sentinel.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SentinelMetricsTest {

    private SimpleMeterRegistry registry;
    private SentinelMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SentinelMetrics(registry);
    }

    @Test
    @DisplayName("recordGateEvaluation records a timer and an outcome counter")
    void recordGateEvaluation() {
        metrics.recordGateEvaluation("PRODUCTION_CHANGE", "ALLOW", 12);
        metrics.recordGateEvaluation("PRODUCTION_CHANGE", "BLOCK", 30);

        var timer = registry.find("sentinel.gate.duration").tag("gateType", "PRODUCTION_CHANGE").timer();
        assertNotNull(timer);
        assertEquals(2, timer.count());
        assertEquals(42.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);

        var blocked = registry.find("sentinel.gate.evaluations")
                .tag("gateType", "PRODUCTION_CHANGE").tag("outcome", "BLOCK").counter();
        assertNotNull(blocked);
        assertEquals(1.0, blocked.count());
    }

    @Test
    @DisplayName("recordGateDegradation counts by reason")
    void recordGateDegradation() {
        metrics.recordGateDegradation("timeout");
        metrics.recordGateDegradation("timeout");
        metrics.recordGateDegradation("ledger");

        assertEquals(2.0, registry.find("sentinel.gate.conservative_outcomes").tag("reason", "timeout").counter().count());
        assertEquals(1.0, registry.find("sentinel.gate.conservative_outcomes").tag("reason", "ledger").counter().count());
    }

    @Test
    @DisplayName("recordChainVerification separates valid and tampered")
    void recordChainVerification() {
        metrics.recordChainVerification(true);
        metrics.recordChainVerification(false);
        metrics.recordChainVerification(true);

        var valid = registry.find("sentinel.ledger.verifications").tag("result", "valid").counter();
        var tampered = registry.find("sentinel.ledger.verifications").tag("result", "tampered").counter();
        assertEquals(2.0, valid.count());
        assertEquals(1.0, tampered.count());
    }

    @Test
    @DisplayName("ledger appends and conflicts are counted")
    void ledgerCounters() {
        metrics.recordLedgerAppend("GATE_ALLOWED");
        metrics.recordLedgerConflict();

        assertEquals(1.0, registry.find("sentinel.ledger.appends").tag("eventType", "GATE_ALLOWED").counter().count());
        assertEquals(1.0, registry.find("sentinel.ledger.conflicts").counter().count());
    }

    @Test
    @DisplayName("change transitions and rollbacks are tagged")
    void changeCounters() {
        metrics.recordChangeTransition("IN_PROGRESS", "FAILED");
        metrics.recordRollback(false);

        assertEquals(1.0, registry.find("sentinel.change.transitions")
                .tag("from", "IN_PROGRESS").tag("to", "FAILED").counter().count());
        assertEquals(1.0, registry.find("sentinel.change.rollbacks").tag("successful", "false").counter().count());
    }

    @Test
    @DisplayName("kill switch activations and policy source retries are counted")
    void killSwitchAndRetryCounters() {
        metrics.recordKillSwitchActivation("HARD_STOP");
        metrics.recordPolicySourceRetry();
        metrics.recordPolicySourceRetry();

        assertEquals(1.0, registry.find("sentinel.kill_switch.activations").tag("mode", "HARD_STOP").counter().count());
        assertEquals(2.0, registry.find("sentinel.policy_source.retries").counter().count());
    }
}

package com.sentinel.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for gate evaluation, the audit ledger and change requests.
 */
@Service
public class SentinelMetrics {

    private final MeterRegistry registry;

    public SentinelMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordGateEvaluation(String gateType, String outcome, long ms) {
        Timer.builder("sentinel.gate.duration")
                .tag("gateType", gateType)
                .register(registry)
                .record(Duration.ofMillis(ms));
        Counter.builder("sentinel.gate.evaluations")
                .tag("gateType", gateType)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records a gate evaluation that ended in a conservative outcome without a full decision.
     *
     * @param reason "timeout", "policy_source", "ledger" or "rejected"
     */
    public void recordGateDegradation(String reason) {
        Counter.builder("sentinel.gate.conservative_outcomes")
                .description("Evaluations resolved conservatively after a failure")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordPolicySourceRetry() {
        Counter.builder("sentinel.policy_source.retries")
                .register(registry)
                .increment();
    }

    public void recordLedgerAppend(String eventType) {
        Counter.builder("sentinel.ledger.appends")
                .tag("eventType", eventType)
                .register(registry)
                .increment();
    }

    public void recordLedgerConflict() {
        Counter.builder("sentinel.ledger.conflicts")
                .description("Appends rejected because the chain tip moved")
                .register(registry)
                .increment();
    }

    public void recordChainVerification(boolean valid) {
        Counter.builder("sentinel.ledger.verifications")
                .tag("result", valid ? "valid" : "tampered")
                .register(registry)
                .increment();
    }

    public void recordChangeTransition(String from, String to) {
        Counter.builder("sentinel.change.transitions")
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
    }

    public void recordRollback(boolean successful) {
        Counter.builder("sentinel.change.rollbacks")
                .tag("successful", String.valueOf(successful))
                .register(registry)
                .increment();
    }

    public void recordKillSwitchActivation(String mode) {
        Counter.builder("sentinel.kill_switch.activations")
                .tag("mode", mode)
                .register(registry)
                .increment();
    }
}

package com.sentinel.core.gate;

import com.sentinel.core.policy.KillSwitch;
import com.sentinel.core.policy.KillSwitchMode;
import com.sentinel.core.policy.KillSwitchTrigger;
import com.sentinel.core.policy.Scope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KillSwitchEvaluatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    private static KillSwitch active(String key, KillSwitchMode mode) {
        return KillSwitch.define(key, key, Scope.GLOBAL, mode)
                .activate("ops", "reason for " + key, KillSwitchTrigger.MANUAL, null, NOW.minusSeconds(60), null);
    }

    @Test
    @DisplayName("no switches: nothing to report")
    void noSwitches() {
        KillSwitchEvaluator.Verdict verdict = KillSwitchEvaluator.evaluate(List.of(), OperationKind.WRITE, NOW);

        assertFalse(verdict.isTerminal());
        assertFalse(verdict.degraded());
        assertTrue(verdict.checks().isEmpty());
    }

    @Test
    @DisplayName("HARD_STOP is terminal for reads and writes")
    void hardStop() {
        List<KillSwitch> switches = List.of(active("halt", KillSwitchMode.HARD_STOP));

        assertEquals(GateOutcome.HARD_STOP, KillSwitchEvaluator.evaluate(switches, OperationKind.READ, NOW).outcome());
        assertEquals(GateOutcome.HARD_STOP, KillSwitchEvaluator.evaluate(switches, OperationKind.WRITE, NOW).outcome());
    }

    @Test
    @DisplayName("SOFT_STOP blocks writes only")
    void softStop() {
        List<KillSwitch> switches = List.of(active("soft", KillSwitchMode.SOFT_STOP));

        KillSwitchEvaluator.Verdict write = KillSwitchEvaluator.evaluate(switches, OperationKind.WRITE, NOW);
        KillSwitchEvaluator.Verdict read = KillSwitchEvaluator.evaluate(switches, OperationKind.READ, NOW);

        assertEquals(GateOutcome.BLOCK, write.outcome());
        assertTrue(write.checks().get(0).triggered());
        assertFalse(read.isTerminal());
        assertFalse(read.checks().get(0).triggered());
    }

    @Test
    @DisplayName("the most severe switch decides, whatever the input order")
    void severityOrdering() {
        List<KillSwitch> switches = List.of(
                active("degrade", KillSwitchMode.DEGRADE),
                active("read-only", KillSwitchMode.READ_ONLY),
                active("halt", KillSwitchMode.HARD_STOP));

        KillSwitchEvaluator.Verdict verdict = KillSwitchEvaluator.evaluate(switches, OperationKind.WRITE, NOW);

        assertEquals(GateOutcome.HARD_STOP, verdict.outcome());
        assertTrue(verdict.reason().contains("halt"));
        assertFalse(verdict.degraded());
        assertEquals(3, verdict.checks().size());
    }

    @Test
    @DisplayName("DEGRADE only sets the marker")
    void degrade() {
        KillSwitchEvaluator.Verdict verdict = KillSwitchEvaluator.evaluate(
                List.of(active("slow", KillSwitchMode.DEGRADE)), OperationKind.WRITE, NOW);

        assertFalse(verdict.isTerminal());
        assertTrue(verdict.degraded());
        assertTrue(verdict.checks().get(0).triggered());
    }

    @Test
    @DisplayName("expired switches are listed but never applied")
    void expiredSwitch() {
        KillSwitch expiring = KillSwitch.define("timed", "timed", Scope.GLOBAL, KillSwitchMode.HARD_STOP)
                .activate("ops", "maintenance", KillSwitchTrigger.MANUAL, null,
                        NOW.minus(Duration.ofHours(2)), NOW.minus(Duration.ofHours(1)));

        KillSwitchEvaluator.Verdict verdict = KillSwitchEvaluator.evaluate(List.of(expiring), OperationKind.WRITE, NOW);

        assertFalse(verdict.isTerminal());
        assertEquals(1, verdict.checks().size());
        assertFalse(verdict.checks().get(0).triggered());
    }
}

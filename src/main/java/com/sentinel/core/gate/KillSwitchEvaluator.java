package com.sentinel.core.gate;

import com.sentinel.core.policy.KillSwitch;
import com.sentinel.core.policy.KillSwitchMode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Resolves active kill switches into a terminal outcome, a degrade marker, or nothing.
 * <p>
 * Precedence:
 * <ol>
 *   <li>any HARD_STOP switch: {@link GateOutcome#HARD_STOP}, whatever the operation</li>
 *   <li>highest-severity switch SOFT_STOP or READ_ONLY on a write: {@link GateOutcome#BLOCK}</li>
 *   <li>any DEGRADE switch: evaluation continues with the degrade marker set</li>
 * </ol>
 * Switches past their auto-deactivate time are listed but never applied.
 */
public final class KillSwitchEvaluator {

    private KillSwitchEvaluator() {}

    /**
     * @param outcome  terminal outcome, or {@code null} when policy evaluation should continue
     * @param degraded at least one DEGRADE switch is in force
     * @param checks   one entry per switch consulted
     * @param reason   explanation of the terminal outcome or degrade marker
     */
    public record Verdict(GateOutcome outcome, boolean degraded, List<KillSwitchCheck> checks, String reason) {

        public boolean isTerminal() {
            return outcome != null;
        }
    }

    public static Verdict evaluate(List<KillSwitch> switches, OperationKind operation, Instant now) {
        List<KillSwitch> effective = switches.stream()
                .filter(ks -> ks.isEffective(now))
                .sorted(Comparator.comparingInt((KillSwitch ks) -> ks.mode().severity()).reversed()
                        .thenComparing(KillSwitch::key))
                .toList();

        KillSwitch strongest = effective.isEmpty() ? null : effective.get(0);
        GateOutcome outcome = null;
        String reason = null;
        if (strongest != null) {
            KillSwitchMode mode = strongest.mode();
            if (mode == KillSwitchMode.HARD_STOP) {
                outcome = GateOutcome.HARD_STOP;
                reason = "Hard stop by kill switch " + strongest.key() + ": " + strongest.reason();
            } else if ((mode == KillSwitchMode.SOFT_STOP || mode == KillSwitchMode.READ_ONLY)
                    && operation == OperationKind.WRITE) {
                outcome = GateOutcome.BLOCK;
                reason = "Writes refused by kill switch " + strongest.key() + " (" + mode + "): " + strongest.reason();
            }
        }

        boolean degraded = outcome == null
                && effective.stream().anyMatch(ks -> ks.mode() == KillSwitchMode.DEGRADE);
        if (degraded) {
            reason = "Degraded by kill switch " + effective.stream()
                    .filter(ks -> ks.mode() == KillSwitchMode.DEGRADE)
                    .map(KillSwitch::key)
                    .findFirst()
                    .orElse("?");
        }

        List<KillSwitchCheck> checks = new ArrayList<>();
        for (KillSwitch ks : switches) {
            boolean inForce = ks.isEffective(now);
            boolean triggered = inForce && triggers(ks, outcome, degraded, operation);
            String detail;
            if (!inForce) {
                detail = "past auto-deactivate time " + ks.autoDeactivateAt();
            } else if (triggered) {
                detail = "applied (" + ks.mode() + ")";
            } else {
                detail = "active, not applicable to " + operation;
            }
            checks.add(new KillSwitchCheck(ks.id(), ks.key(), ks.mode(), ks.scope().toString(), triggered, detail));
        }
        return new Verdict(outcome, degraded, checks, reason);
    }

    private static boolean triggers(KillSwitch ks, GateOutcome outcome, boolean degraded, OperationKind operation) {
        return switch (ks.mode()) {
            case HARD_STOP -> true;
            case SOFT_STOP, READ_ONLY -> operation == OperationKind.WRITE
                    && (outcome == GateOutcome.BLOCK);
            case DEGRADE -> degraded;
        };
    }
}

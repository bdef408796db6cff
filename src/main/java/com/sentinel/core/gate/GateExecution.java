package com.sentinel.core.gate;

import com.sentinel.core.ledger.Actor;
import com.sentinel.core.policy.GateType;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only record of one gate evaluation. References its ledger event by id only.
 *
 * @param id               execution record id
 * @param gateId           evaluated gate (nullable when the gate key was unknown)
 * @param gateKey          requested gate key
 * @param gateType         evaluated gate type (nullable when unknown)
 * @param executionId      caller's execution correlation id
 * @param requestId        caller's request id
 * @param actor            who asked
 * @param outcome          final outcome
 * @param policyResults    per-policy results in evaluation order
 * @param killSwitchChecks per-switch checks
 * @param evidence         captured inputs/outputs/context and diagnostic entries
 * @param durationMs       evaluation time
 * @param errors           errors encountered
 * @param ledgerEventId    the GATE_EXECUTED/GATE_BLOCKED event (null if it could not be written)
 * @param createdAt        evaluation start
 */
public record GateExecution(
    UUID id,
    String gateId,
    String gateKey,
    GateType gateType,
    String executionId,
    String requestId,
    Actor actor,
    GateOutcome outcome,
    List<PolicyResult> policyResults,
    List<KillSwitchCheck> killSwitchChecks,
    Map<String, Object> evidence,
    long durationMs,
    List<String> errors,
    UUID ledgerEventId,
    Instant createdAt
) {

    public GateExecution {
        policyResults = policyResults == null ? List.of() : List.copyOf(policyResults);
        killSwitchChecks = killSwitchChecks == null ? List.of() : List.copyOf(killSwitchChecks);
        evidence = evidence == null ? Map.of() : evidence;
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}

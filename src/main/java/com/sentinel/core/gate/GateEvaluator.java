package com.sentinel.core.gate;

import com.sentinel.core.error.PolicySourceUnavailableException;
import com.sentinel.core.error.TamperDetectedException;
import com.sentinel.core.events.AlertSeverity;
import com.sentinel.core.events.GovernanceAlert;
import com.sentinel.core.events.NotificationPublisher;
import com.sentinel.core.ledger.AuditEventDraft;
import com.sentinel.core.ledger.AuditEventType;
import com.sentinel.core.ledger.EventOutcome;
import com.sentinel.core.ledger.Ledger;
import com.sentinel.core.logging.MdcContext;
import com.sentinel.core.metrics.SentinelMetrics;
import com.sentinel.core.policy.ControlPolicy;
import com.sentinel.core.policy.EnforcementGate;
import com.sentinel.core.policy.EnforcementMode;
import com.sentinel.core.policy.KillSwitch;
import com.sentinel.core.policy.PolicySource;
import com.sentinel.core.policy.Scope;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Evaluates enforcement gates: kill switches first, then control policies, and
 * records every decision as a {@link GateExecution} plus one ledger event.
 * <p>
 * Guarantees:
 * <ul>
 *   <li>no exception crosses {@link #evaluate}; every failure becomes a conservative outcome</li>
 *   <li>a HARD_STOP kill switch always wins, break-glass grants included</li>
 *   <li>unknown or inactive gates fail closed with BLOCK</li>
 *   <li>a decision that cannot be written to the ledger is returned as BLOCK</li>
 *   <li>evaluations run on a bounded worker pool with a caller-supplied timeout; a timed-out
 *       evaluation yields BLOCK (WARNING for monitoring gates) with a {@code timeout} evidence entry</li>
 * </ul>
 * No lock is held while calling the policy source; the only serialized section is the ledger append.
 */
@Service
public class GateEvaluator {

    private static final Logger log = LoggerFactory.getLogger(GateEvaluator.class);

    private final PolicySource policySource;
    private final Ledger ledger;
    private final GateExecutionStore executionStore;
    private final Clock clock;
    private final GateProperties properties;
    private final NotificationPublisher notifications;
    private final EmergencyOverrides overrides;
    private final SentinelMetrics metrics;
    private final ThreadPoolExecutor workers;

    public GateEvaluator(PolicySource policySource,
                         Ledger ledger,
                         GateExecutionStore executionStore,
                         Clock clock,
                         GateProperties properties,
                         NotificationPublisher notifications,
                         @Autowired(required = false) EmergencyOverrides overrides,
                         @Autowired(required = false) SentinelMetrics metrics) {
        this.policySource = policySource;
        this.ledger = ledger;
        this.executionStore = executionStore;
        this.clock = clock;
        this.properties = properties;
        this.notifications = notifications;
        this.overrides = overrides;
        this.metrics = metrics;

        AtomicInteger threadCount = new AtomicInteger();
        int threads = Math.max(1, properties.getWorkerThreads());
        this.workers = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, properties.getQueueCapacity())),
                r -> {
                    Thread t = new Thread(r, "gate-eval-" + threadCount.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }

    /**
     * Evaluates within the configured default timeout, shortened by the gate's own timeout if it has one.
     */
    public GateDecision evaluate(EvaluationRequest request) {
        return evaluate(request, null);
    }

    /**
     * Evaluates a gate and returns a terminal decision.
     *
     * @param timeout maximum time to wait for the decision; {@code null} uses the default timeout,
     *                capped by the gate's own timeout
     */
    public GateDecision evaluate(EvaluationRequest request, Duration timeout) {
        long startNanos = System.nanoTime();
        Instant startedAt = clock.instant();
        MdcContext.setGate(request.gateKey(), request.executionId());
        try {
            AtomicReference<EnforcementGate> resolvedGate = new AtomicReference<>();
            Evaluation evaluation = runWithTimeout(request, timeout, startNanos, resolvedGate);
            return record(request, evaluation, startNanos, startedAt);
        } catch (RuntimeException e) {
            log.error("Gate {} evaluation failed unexpectedly; blocking", request.gateKey(), e);
            return new GateDecision(GateOutcome.BLOCK, null, null,
                    "Internal evaluation failure: " + e.getMessage(), null);
        } finally {
            MdcContext.clearGate();
        }
    }

    private Evaluation runWithTimeout(EvaluationRequest request, Duration timeout, long startNanos,
                                      AtomicReference<EnforcementGate> resolvedGate) {
        Duration budget = timeout != null ? timeout : properties.getDefaultTimeout();
        long deadline = startNanos + budget.toNanos();

        Future<Evaluation> future;
        try {
            future = workers.submit(() -> decideWithMdc(request, startNanos, deadline, timeout != null, resolvedGate));
        } catch (RejectedExecutionException e) {
            degraded("rejected");
            return Evaluation.conservative(null, "Evaluation capacity exhausted");
        }

        try {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            degraded("timeout");
            log.warn("Gate {} timed out after {}ms", request.gateKey(), budget.toMillis());
            Evaluation timedOut = Evaluation.conservative(resolvedGate.get(),
                    "Evaluation timed out after " + budget.toMillis() + "ms");
            timedOut.evidence.put("timeout", Map.of("timeoutMs", budget.toMillis()));
            return timedOut;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Gate {} evaluation raised {}", request.gateKey(), cause.toString());
            return Evaluation.conservative(resolvedGate.get(), "Evaluation failed: " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return Evaluation.conservative(resolvedGate.get(), "Evaluation interrupted");
        }
    }

    private Evaluation decideWithMdc(EvaluationRequest request, long startNanos, long deadline,
                                     boolean callerTimeout, AtomicReference<EnforcementGate> resolvedGate)
            throws InterruptedException {
        MdcContext.setGate(request.gateKey(), request.executionId());
        try {
            return decide(request, startNanos, deadline, callerTimeout, resolvedGate);
        } finally {
            MdcContext.clearGate();
        }
    }

    // ── Decision ─────────────────────────────────────────────────────────

    private Evaluation decide(EvaluationRequest request, long startNanos, long callerDeadline,
                              boolean callerTimeout, AtomicReference<EnforcementGate> resolvedGate)
            throws InterruptedException {
        long deadline = callerDeadline;
        Optional<EnforcementGate> found;
        try {
            found = fetch(() -> policySource.gate(request.gateKey()), deadline, "gate " + request.gateKey());
        } catch (FetchFailedException e) {
            return Evaluation.conservative(null, e.getMessage());
        }
        if (found.isEmpty()) {
            return Evaluation.blocked(null, "Unknown gate: " + request.gateKey());
        }

        EnforcementGate gate = found.get();
        resolvedGate.set(gate);
        if (!gate.active()) {
            return Evaluation.blocked(gate, "Gate " + gate.key() + " is inactive");
        }

        if (!callerTimeout && gate.timeout() != null) {
            deadline = Math.min(deadline, startNanos + gate.timeout().toNanos());
        }

        Evaluation evaluation = new Evaluation(gate);
        captureEvidence(gate, request, evaluation);
        Scope scope = gate.scope().orElse(request.scope());
        Instant now = clock.instant();

        boolean degradeWrite = false;
        String degradeReason = null;
        if (gate.checkKillSwitches()) {
            List<KillSwitch> switches;
            try {
                switches = fetch(() -> policySource.activeKillSwitches(scope), deadline, "kill switches");
            } catch (FetchFailedException e) {
                return Evaluation.conservative(gate, e.getMessage());
            }
            KillSwitchEvaluator.Verdict verdict = KillSwitchEvaluator.evaluate(switches, request.operation(), now);
            evaluation.killSwitchChecks.addAll(verdict.checks());
            if (verdict.isTerminal()) {
                return evaluation.finish(verdict.outcome(), verdict.reason());
            }
            if (verdict.degraded()) {
                degradeWrite = request.operation() == OperationKind.WRITE;
                degradeReason = verdict.reason();
                evaluation.evidence.put("degrade", Map.of(
                        "reason", verdict.reason(),
                        "operation", request.operation().name(),
                        "effect", degradeWrite ? "outcome" : "informational"));
            }
        }

        if (request.breakGlassGrantId() != null) {
            boolean honoured = overrides != null && overrides.isActive(request.breakGlassGrantId(), scope, now);
            evaluation.evidence.put("breakGlass", Map.of(
                    "grantId", request.breakGlassGrantId().toString(),
                    "honoured", honoured));
            if (honoured) {
                return degradeWrite
                        ? evaluation.finish(GateOutcome.DEGRADE, "Policies bypassed by break-glass grant; degraded")
                        : evaluation.finish(GateOutcome.ALLOW,
                                "Policies bypassed by break-glass grant " + request.breakGlassGrantId());
            }
        }

        List<ControlPolicy> policies;
        try {
            policies = fetch(() -> policySource.activePolicies(gate.id()), deadline, "policies for " + gate.key());
        } catch (FetchFailedException e) {
            return Evaluation.conservative(gate, e.getMessage());
        }

        List<ControlPolicy> ordered = new ArrayList<>(policies);
        ordered.sort(ControlPolicy.EVALUATION_ORDER);
        for (ControlPolicy policy : ordered) {
            PolicyResult result = PolicyEvaluator.evaluate(policy, request.context());
            evaluation.policyResults.add(result);
            if (result.status() == PolicyResultStatus.ERROR) {
                evaluation.errors.add("Policy " + policy.key() + ": " + result.detail());
            }
        }

        if (System.nanoTime() > deadline) {
            degraded("timeout");
            long limitMs = TimeUnit.NANOSECONDS.toMillis(deadline - startNanos);
            Evaluation timedOut = Evaluation.conservative(gate, "Evaluation exceeded gate timeout of " + limitMs + "ms");
            timedOut.evidence.putAll(evaluation.evidence);
            timedOut.evidence.put("timeout", Map.of("timeoutMs", limitMs));
            timedOut.policyResults.addAll(evaluation.policyResults);
            timedOut.killSwitchChecks.addAll(evaluation.killSwitchChecks);
            return timedOut;
        }

        OutcomeResolver.Resolution resolution =
                OutcomeResolver.resolve(evaluation.policyResults, gate.requireAllPass(), gate.mode());
        boolean policyError = !evaluation.errors.isEmpty();
        if (degradeWrite && !policyError) {
            return evaluation.finish(GateOutcome.DEGRADE, degradeReason);
        }
        return evaluation.finish(resolution.outcome(), resolution.reason());
    }

    private void captureEvidence(EnforcementGate gate, EvaluationRequest request, Evaluation evaluation) {
        evaluation.evidence.put("operation", request.operation().name());
        if (gate.captureContext()) {
            evaluation.evidence.put("context", request.context());
        }
        if (gate.captureInputs()) {
            evaluation.evidence.put("inputs", request.inputs());
        }
        if (gate.captureOutputs()) {
            evaluation.evidence.put("outputs", request.outputs());
        }
    }

    /**
     * Calls the policy source, retrying transient failures with exponential backoff
     * for as long as the deadline allows.
     */
    private <T> T fetch(Supplier<T> call, long deadline, String what)
            throws FetchFailedException, InterruptedException {
        GateProperties.Retry retry = properties.getRetry();
        int maxAttempts = Math.max(1, retry.getMaxAttempts());
        long backoff = retry.getInitialBackoff().toNanos();
        long maxBackoff = retry.getMaxBackoff().toNanos();

        PolicySourceUnavailableException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.get();
            } catch (PolicySourceUnavailableException e) {
                last = e;
                long remaining = deadline - System.nanoTime();
                if (attempt == maxAttempts || remaining <= backoff) {
                    break;
                }
                log.warn("Policy source unavailable fetching {} (attempt {}/{}): {}",
                        what, attempt, maxAttempts, e.getMessage());
                if (metrics != null) {
                    metrics.recordPolicySourceRetry();
                }
                TimeUnit.NANOSECONDS.sleep(backoff);
                backoff = Math.min(backoff * 2, maxBackoff);
            }
        }
        degraded("policy_source");
        throw new FetchFailedException("Policy source unavailable fetching " + what
                + (last != null ? ": " + last.getMessage() : ""));
    }

    // ── Recording ────────────────────────────────────────────────────────

    private GateDecision record(EvaluationRequest request, Evaluation evaluation, long startNanos, Instant startedAt) {
        EnforcementGate gate = evaluation.gate;
        UUID executionRecordId = UUID.randomUUID();
        UUID ledgerEventId = UUID.randomUUID();
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

        GateOutcome outcome = evaluation.outcome;
        String reason = evaluation.reason;
        UUID linkedEventId;
        try {
            ledger.append(ledgerDraft(ledgerEventId, executionRecordId, request, evaluation, durationMs));
            linkedEventId = ledgerEventId;
        } catch (RuntimeException e) {
            linkedEventId = null;
            outcome = GateOutcome.BLOCK;
            reason = "Decision could not be recorded in the audit ledger: " + e.getMessage();
            evaluation.errors.add(reason);
            degraded("ledger");
            log.error("Gate {} decision not recorded; blocking: {}", request.gateKey(), e.getMessage());
            if (e instanceof TamperDetectedException) {
                notifications.publish(new GovernanceAlert("ledger.tamper_detected", AlertSeverity.CRITICAL,
                        request.gateKey(), e.getMessage(), Map.of("gateKey", request.gateKey()), clock.instant()));
            }
        }

        GateExecution execution = new GateExecution(
                executionRecordId,
                gate != null ? gate.id() : null,
                request.gateKey(),
                gate != null ? gate.type() : null,
                request.executionId(),
                request.requestId(),
                request.actor(),
                outcome,
                evaluation.policyResults,
                evaluation.killSwitchChecks,
                evaluation.evidence,
                durationMs,
                evaluation.errors,
                linkedEventId,
                startedAt);
        try {
            executionStore.save(execution);
        } catch (RuntimeException e) {
            log.error("Failed to store gate execution {} (ledger event {})", executionRecordId, linkedEventId, e);
        }

        if (metrics != null) {
            metrics.recordGateEvaluation(gate != null ? gate.type().name() : "UNKNOWN", outcome.name(), durationMs);
        }
        if (outcome == GateOutcome.ALLOW) {
            log.info("Gate {} -> {} for {} ({}ms)", request.gateKey(), outcome, request.actor(), durationMs);
        } else {
            log.warn("Gate {} -> {} for {}: {}", request.gateKey(), outcome, request.actor(), reason);
        }

        return new GateDecision(outcome, executionRecordId, linkedEventId, reason, gate != null ? gate.mode() : null);
    }

    private AuditEventDraft ledgerDraft(UUID eventId, UUID executionRecordId, EvaluationRequest request,
                                       Evaluation evaluation, long durationMs) {
        EnforcementGate gate = evaluation.gate;
        List<Map<String, Object>> policies = new ArrayList<>();
        for (PolicyResult r : evaluation.policyResults) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("policyId", r.policyId());
            entry.put("priority", r.priority());
            entry.put("status", r.status().name());
            entry.put("autoDenied", r.autoDenied());
            policies.add(entry);
        }
        List<String> triggeredSwitches = evaluation.killSwitchChecks.stream()
                .filter(KillSwitchCheck::triggered)
                .map(KillSwitchCheck::key)
                .toList();

        return AuditEventDraft.builder(evaluation.outcome.isBlocking()
                        ? AuditEventType.GATE_BLOCKED : AuditEventType.GATE_EXECUTED)
                .id(eventId)
                .action("gate.evaluate")
                .actor(request.actor())
                .resource("enforcement_gate", gate != null ? gate.id() : request.gateKey(), request.gateKey())
                .outcome(toEventOutcome(evaluation.outcome))
                .context("gateExecutionId", executionRecordId.toString())
                .context("executionId", request.executionId())
                .context("requestId", request.requestId())
                .context("gateType", gate != null ? gate.type().name() : null)
                .context("enforcementMode", gate != null ? gate.mode().name() : null)
                .context("outcome", evaluation.outcome.name())
                .context("reason", evaluation.reason)
                .context("policyResults", policies)
                .context("killSwitchesTriggered", triggeredSwitches)
                .context("evidence", evaluation.evidence)
                .context("errors", evaluation.errors)
                .context("durationMs", durationMs)
                .build();
    }

    private static EventOutcome toEventOutcome(GateOutcome outcome) {
        return switch (outcome) {
            case ALLOW -> EventOutcome.SUCCESS;
            case WARNING, DEGRADE -> EventOutcome.WARNING;
            case BLOCK, HARD_STOP -> EventOutcome.BLOCKED;
        };
    }

    private void degraded(String reason) {
        if (metrics != null) {
            metrics.recordGateDegradation(reason);
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    /**
     * Mutable working state of one evaluation; confined to the thread that built it.
     */
    private static final class Evaluation {
        private final EnforcementGate gate;
        private final List<PolicyResult> policyResults = new ArrayList<>();
        private final List<KillSwitchCheck> killSwitchChecks = new ArrayList<>();
        private final Map<String, Object> evidence = new LinkedHashMap<>();
        private final List<String> errors = new ArrayList<>();
        private GateOutcome outcome;
        private String reason;

        private Evaluation(EnforcementGate gate) {
            this.gate = gate;
        }

        private Evaluation finish(GateOutcome finalOutcome, String finalReason) {
            this.outcome = finalOutcome;
            this.reason = finalReason;
            return this;
        }

        /** BLOCK regardless of mode. */
        static Evaluation blocked(EnforcementGate gate, String reason) {
            Evaluation e = new Evaluation(gate);
            e.errors.add(reason);
            return e.finish(GateOutcome.BLOCK, reason);
        }

        /** BLOCK, or WARNING when the gate is known to be in monitoring mode. */
        static Evaluation conservative(EnforcementGate gate, String reason) {
            Evaluation e = new Evaluation(gate);
            e.errors.add(reason);
            boolean monitoring = gate != null && gate.mode() == EnforcementMode.MONITORING;
            return e.finish(monitoring ? GateOutcome.WARNING : GateOutcome.BLOCK, reason);
        }
    }

    private static final class FetchFailedException extends Exception {
        FetchFailedException(String message) {
            super(message);
        }
    }
}

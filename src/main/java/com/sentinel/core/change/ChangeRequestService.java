package com.sentinel.core.change;

import com.sentinel.core.error.ConflictException;
import com.sentinel.core.error.NotFoundException;
import com.sentinel.core.error.ValidationException;
import com.sentinel.core.error.WindowExpiredException;
import com.sentinel.core.events.AlertSeverity;
import com.sentinel.core.events.GovernanceAlert;
import com.sentinel.core.events.NotificationPublisher;
import com.sentinel.core.gate.EvaluationRequest;
import com.sentinel.core.gate.GateDecision;
import com.sentinel.core.gate.GateEvaluator;
import com.sentinel.core.gate.OperationKind;
import com.sentinel.core.ledger.Actor;
import com.sentinel.core.ledger.AuditEventDraft;
import com.sentinel.core.ledger.AuditEventType;
import com.sentinel.core.ledger.EventOutcome;
import com.sentinel.core.ledger.Ledger;
import com.sentinel.core.logging.MdcContext;
import com.sentinel.core.metrics.SentinelMetrics;
import com.sentinel.core.policy.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Drives change requests through their lifecycle.
 * <p>
 * Every state change goes through {@link #commit}: the transition table is consulted first,
 * the new state is written with an optimistic version check, and exactly one ledger event
 * is appended and linked into the request. If the ledger refuses the event the stored
 * state is put back and the ledger error is rethrown.
 */
@Service
public class ChangeRequestService {

    private static final Logger log = LoggerFactory.getLogger(ChangeRequestService.class);

    static final Actor AUTO_APPROVER = Actor.system("auto-approval");

    private static final Map<String, Function<ChangeRequest, Object>> EDITABLE_FIELDS = new LinkedHashMap<>();

    static {
        EDITABLE_FIELDS.put("changeType", ChangeRequest::getChangeType);
        EDITABLE_FIELDS.put("riskLevel", ChangeRequest::getRiskLevel);
        EDITABLE_FIELDS.put("title", ChangeRequest::getTitle);
        EDITABLE_FIELDS.put("description", ChangeRequest::getDescription);
        EDITABLE_FIELDS.put("rationale", ChangeRequest::getRationale);
        EDITABLE_FIELDS.put("rollbackProcedure", ChangeRequest::getRollbackProcedure);
        EDITABLE_FIELDS.put("workflowId", ChangeRequest::getWorkflowId);
        EDITABLE_FIELDS.put("capabilityId", ChangeRequest::getCapabilityId);
        EDITABLE_FIELDS.put("verificationRequired", ChangeRequest::isVerificationRequired);
        EDITABLE_FIELDS.put("verificationCriteria", ChangeRequest::getVerificationCriteria);
        EDITABLE_FIELDS.put("changeDetails", ChangeRequest::getChangeDetails);
        EDITABLE_FIELDS.put("impactAssessment", ChangeRequest::getImpactAssessment);
        EDITABLE_FIELDS.put("testingEvidence", ChangeRequest::getTestingEvidence);
        EDITABLE_FIELDS.put("metadata", ChangeRequest::getMetadata);
    }

    private final ChangeRequestStore store;
    private final Ledger ledger;
    private final GateEvaluator gateEvaluator;
    private final RollbackExecutor rollbackExecutor;
    private final NotificationPublisher notifications;
    private final Clock clock;
    private final ChangeProperties properties;
    private final SentinelMetrics metrics;

    public ChangeRequestService(ChangeRequestStore store,
                                Ledger ledger,
                                GateEvaluator gateEvaluator,
                                RollbackExecutor rollbackExecutor,
                                NotificationPublisher notifications,
                                Clock clock,
                                ChangeProperties properties,
                                @Autowired(required = false) SentinelMetrics metrics) {
        this.store = store;
        this.ledger = ledger;
        this.gateEvaluator = gateEvaluator;
        this.rollbackExecutor = rollbackExecutor;
        this.notifications = notifications;
        this.clock = clock;
        this.properties = properties;
        this.metrics = metrics;
    }

    // ── Queries ──────────────────────────────────────────────────────────

    public ChangeRequest get(UUID id) {
        return store.load(id).orElseThrow(() -> new NotFoundException("Change request", id));
    }

    public List<ChangeRequest> list() {
        return store.list();
    }

    // ── Drafting and review ──────────────────────────────────────────────

    public ChangeRequest create(ChangeRequestDraft draft) {
        List<String> violations = new ArrayList<>();
        if (isBlank(draft.changeKey())) {
            violations.add("changeKey is required");
        }
        if (draft.changeType() == null) {
            violations.add("changeType is required");
        }
        if (isBlank(draft.title())) {
            violations.add("title is required");
        }
        if (draft.requestedBy() == null) {
            violations.add("requestedBy is required");
        }
        if (!violations.isEmpty()) {
            throw new ValidationException("Invalid change request draft", violations);
        }

        ChangeRequest request = ChangeRequest.fromDraft(draft, clock.instant());
        UUID eventId = UUID.randomUUID();
        request.getLedgerEventIds().add(eventId);
        store.save(request, 0);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("changeType", draft.changeType().name());
        details.put("title", draft.title());
        try {
            ledger.append(event(AuditEventType.CHANGE_REQUEST_CREATED, eventId, request, draft.requestedBy(),
                    EventOutcome.SUCCESS, null, ChangeStatus.DRAFT, details));
        } catch (RuntimeException e) {
            discard(request);
            throw e;
        }

        log.info("Created change request {} ({}) for {}", request.getChangeKey(), request.getId(), draft.requestedBy());
        return request;
    }

    /**
     * Replaces the editable content of a DRAFT (everything except key and requester)
     * and records which fields changed.
     *
     * @throws com.sentinel.core.error.InvalidTransitionException once the request has been submitted
     */
    public ChangeRequest update(UUID id, Actor actor, ChangeRequestDraft draft) {
        return withChange(id, () -> {
            ChangeRequest current = get(id);
            ChangeTransitions.next(current.getStatus(), ChangeAction.UPDATE);

            List<String> violations = new ArrayList<>();
            if (draft.changeKey() != null && !draft.changeKey().equals(current.getChangeKey())) {
                violations.add("changeKey cannot be changed");
            }
            if (draft.changeType() == null) {
                violations.add("changeType is required");
            }
            if (isBlank(draft.title())) {
                violations.add("title is required");
            }
            if (!violations.isEmpty()) {
                throw new ValidationException("Invalid update of change request " + current.getChangeKey(), violations);
            }

            ChangeRequest edited = current.copy();
            edited.applyContent(draft);
            List<String> changed = new ArrayList<>();
            EDITABLE_FIELDS.forEach((name, getter) -> {
                if (!Objects.equals(getter.apply(current), getter.apply(edited))) {
                    changed.add(name);
                }
            });

            return commit(current, ChangeAction.UPDATE, actor, AuditEventType.CHANGE_REQUEST_UPDATED,
                    EventOutcome.SUCCESS, r -> r.applyContent(draft), Map.of("updatedFields", changed));
        });
    }

    /**
     * DRAFT → SUBMITTED. A LOW-risk request continues straight through
     * auto-approval to SCHEDULED, writing one event per step.
     *
     * @throws ValidationException if description, rationale, risk level or rollback procedure is missing
     */
    public ChangeRequest submit(UUID id, Actor actor) {
        return withChange(id, () -> {
            ChangeRequest current = get(id);
            ChangeTransitions.next(current.getStatus(), ChangeAction.SUBMIT);

            List<String> violations = new ArrayList<>();
            if (isBlank(current.getDescription())) {
                violations.add("description is required");
            }
            if (isBlank(current.getRationale())) {
                violations.add("rationale is required");
            }
            if (current.getRiskLevel() == null) {
                violations.add("riskLevel is required");
            }
            if (isBlank(current.getRollbackProcedure())) {
                violations.add("rollbackProcedure is required");
            }
            if (!violations.isEmpty()) {
                throw new ValidationException("Change request " + current.getChangeKey()
                        + " is not ready for submission", violations);
            }

            Instant now = clock.instant();
            ChangeRequest submitted = commit(current, ChangeAction.SUBMIT, actor,
                    AuditEventType.CHANGE_REQUEST_SUBMITTED, EventOutcome.SUCCESS,
                    r -> r.setSubmittedAt(now), Map.of("riskLevel", current.getRiskLevel().name()));

            if (!submitted.getRiskLevel().autoApproves()) {
                return submitted;
            }

            ChangeRequest approved = commit(submitted, ChangeAction.AUTO_APPROVE, AUTO_APPROVER,
                    AuditEventType.CHANGE_REQUEST_AUTO_APPROVED, EventOutcome.SUCCESS,
                    r -> {
                        r.setApprovedBy(AUTO_APPROVER.id());
                        r.setApprovedAt(now);
                        r.setApprovalNotes("Auto-approved: " + r.getRiskLevel() + " risk");
                    },
                    Map.of("riskLevel", submitted.getRiskLevel().name()));
            return schedule(approved, AUTO_APPROVER, now, ChangeAction.SCHEDULE);
        });
    }

    /**
     * SUBMITTED → UNDER_REVIEW.
     */
    public ChangeRequest beginReview(UUID id, Actor reviewer) {
        return withChange(id, () -> startReview(get(id), reviewer));
    }

    /**
     * Completes the review and hands the request to approvers (UNDER_REVIEW → PENDING_APPROVAL).
     * A SUBMITTED request enters review first.
     */
    public ChangeRequest review(UUID id, Actor reviewer, String notes) {
        return withChange(id, () -> {
            ChangeRequest current = get(id);
            if (current.getStatus() == ChangeStatus.SUBMITTED) {
                current = startReview(current, reviewer);
            }
            ChangeTransitions.next(current.getStatus(), ChangeAction.COMPLETE_REVIEW);
            requireDistinct(reviewer, current.getRequestedBy(), "reviewer", "requester");

            Instant now = clock.instant();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("notes", notes);
            return commit(current, ChangeAction.COMPLETE_REVIEW, reviewer,
                    AuditEventType.CHANGE_REQUEST_REVIEWED, EventOutcome.SUCCESS,
                    r -> {
                        r.setReviewedBy(reviewer.id());
                        r.setReviewedAt(now);
                        r.setReviewNotes(notes);
                    },
                    details);
        });
    }

    /**
     * PENDING_APPROVAL → APPROVED → SCHEDULED. The execution window opens at
     * {@code requestedStart} (or now) and lasts as long as the risk level allows.
     *
     * @throws com.sentinel.core.error.InvalidTransitionException unless the request is PENDING_APPROVAL
     */
    public ChangeRequest approve(UUID id, Actor approver, String notes, Instant requestedStart) {
        return withChange(id, () -> {
            ChangeRequest current = get(id);
            ChangeTransitions.next(current.getStatus(), ChangeAction.APPROVE);
            requireDistinct(approver, current.getRequestedBy(), "approver", "requester");
            if (properties.isEnforceSeparationOfDuties() && approver.id().equals(current.getReviewedBy())) {
                throw new ValidationException("Approver " + approver.id() + " already reviewed change "
                        + current.getChangeKey());
            }

            Instant now = clock.instant();
            Instant start = requestedStart != null ? requestedStart : now;
            checkWindowStillOpen(current, start, now);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("notes", notes);
            ChangeRequest approved = commit(current, ChangeAction.APPROVE, approver,
                    AuditEventType.CHANGE_REQUEST_APPROVED, EventOutcome.SUCCESS,
                    r -> {
                        r.setApprovedBy(approver.id());
                        r.setApprovedAt(now);
                        r.setApprovalNotes(notes);
                    },
                    details);
            return schedule(approved, approver, start, ChangeAction.SCHEDULE);
        });
    }

    public ChangeRequest reject(UUID id, Actor actor, String reason) {
        return withChange(id, () -> {
            if (isBlank(reason)) {
                throw new ValidationException("A rejection reason is required");
            }
            ChangeRequest current = get(id);
            Instant now = clock.instant();
            return commit(current, ChangeAction.REJECT, actor,
                    AuditEventType.CHANGE_REQUEST_REJECTED, EventOutcome.SUCCESS,
                    r -> {
                        r.setRejectedBy(actor.id());
                        r.setRejectedAt(now);
                        r.setRejectionReason(reason);
                    },
                    Map.of("reason", reason));
        });
    }

    public ChangeRequest cancel(UUID id, Actor actor, String reason) {
        return withChange(id, () -> {
            ChangeRequest current = get(id);
            Instant now = clock.instant();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("reason", reason);
            return commit(current, ChangeAction.CANCEL, actor,
                    AuditEventType.CHANGE_REQUEST_CANCELLED, EventOutcome.SUCCESS,
                    r -> {
                        r.setCancelledBy(actor.id());
                        r.setCancelledAt(now);
                        r.setCancellationReason(reason);
                    },
                    details);
        });
    }

    /**
     * Opens a fresh execution window for an approved request, typically after a
     * {@link WindowExpiredException}.
     */
    public ChangeRequest reschedule(UUID id, Actor actor, Instant start) {
        return withChange(id, () -> {
            ChangeRequest current = get(id);
            ChangeTransitions.next(current.getStatus(), ChangeAction.RESCHEDULE);
            Instant now = clock.instant();
            Instant windowStart = start != null ? start : now;
            checkWindowStillOpen(current, windowStart, now);
            return schedule(current, actor, windowStart, ChangeAction.RESCHEDULE);
        });
    }

    // ── Execution ────────────────────────────────────────────────────────

    /**
     * Asks the production-change gate for permission and moves the request to IN_PROGRESS.
     * A refusal sends the request back to APPROVED with a CHANGE_EXECUTION_BLOCKED event.
     *
     * @throws WindowExpiredException outside the scheduled window; the attempt is recorded, the state is not changed
     */
    public ExecutionAttempt beginExecution(UUID id, Actor actor, Map<String, Object> context) {
        return withChange(id, () -> {
            ChangeRequest current = get(id);
            ChangeTransitions.next(current.getStatus(), ChangeAction.BEGIN_EXECUTION);

            Instant now = clock.instant();
            if (!current.isWithinWindow(now)) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("scheduledStart", String.valueOf(current.getScheduledStart()));
                details.put("scheduledEnd", String.valueOf(current.getScheduledEnd()));
                details.put("attemptedAt", now.toString());
                commit(current, null, actor, AuditEventType.CHANGE_WINDOW_EXPIRED, EventOutcome.BLOCKED,
                        r -> { }, details);
                log.warn("Change {} attempted outside its window [{}, {}]",
                        current.getChangeKey(), current.getScheduledStart(), current.getScheduledEnd());
                throw new WindowExpiredException("Change " + current.getChangeKey()
                        + " may only execute between " + current.getScheduledStart() + " and "
                        + current.getScheduledEnd(), current.getScheduledStart(), current.getScheduledEnd(), now);
            }

            EvaluationRequest gateRequest = EvaluationRequest.builder(properties.getProductionGateKey(), actor)
                    .context(context == null ? Map.of() : context)
                    .context(evidenceContext(current))
                    .context("changeId", current.getId().toString())
                    .context("changeKey", current.getChangeKey())
                    .context("changeType", current.getChangeType().name())
                    .context("riskLevel", current.getRiskLevel().name())
                    .operation(OperationKind.WRITE)
                    .requestId(current.getId().toString())
                    .scope(new Scope(current.getWorkflowId(), current.getCapabilityId()))
                    .build();
            GateDecision decision = gateEvaluator.evaluate(gateRequest);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("gateOutcome", decision.outcome().name());
            details.put("gateExecutionId", decision.gateExecutionId() == null ? null : decision.gateExecutionId().toString());
            details.put("gateLedgerEventId", decision.ledgerEventId() == null ? null : decision.ledgerEventId().toString());
            details.put("gateReason", decision.reason());

            if (decision.permitsExecution()) {
                ChangeRequest started = commit(current, ChangeAction.BEGIN_EXECUTION, actor,
                        AuditEventType.CHANGE_EXECUTION_STARTED, EventOutcome.SUCCESS,
                        r -> r.setExecution(ExecutionRecord.started(actor.id(), now)), details);
                return new ExecutionAttempt(started, decision);
            }

            ChangeRequest blocked = commit(current, ChangeAction.BLOCK_EXECUTION, actor,
                    AuditEventType.CHANGE_EXECUTION_BLOCKED, EventOutcome.BLOCKED, r -> { }, details);
            log.warn("Execution of change {} blocked by gate {}: {} ({})", current.getChangeKey(),
                    properties.getProductionGateKey(), decision.outcome(), decision.reason());
            return new ExecutionAttempt(blocked, decision);
        });
    }

    /**
     * Records the executor's result. Failure leads to FAILED and an automatic rollback;
     * success goes to PENDING_VERIFICATION when verification applies, else COMPLETED.
     */
    public ChangeRequest completeExecution(UUID id, Actor actor, ExecutionResult result) {
        return withChange(id, () -> {
            ChangeRequest current = get(id);
            ChangeTransitions.next(current.getStatus(), ChangeAction.COMPLETE_EXECUTION);
            Instant now = clock.instant();
            Consumer<ChangeRequest> recordResult = r -> r.setExecution(
                    (r.getExecution() != null ? r.getExecution() : ExecutionRecord.started(actor.id(), now))
                            .complete(result, now));
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("successful", result.successful());
            details.put("notes", result.notes());

            if (!result.successful()) {
                ChangeRequest failed = commit(current, ChangeAction.FAIL_EXECUTION, actor,
                        AuditEventType.CHANGE_EXECUTION_FAILED, EventOutcome.FAILURE, recordResult, details);
                return rollbackInternal(failed, actor, "Execution failed: " + result.notes(), null);
            }

            if (!current.needsVerification()) {
                return commit(current, ChangeAction.COMPLETE_EXECUTION, actor,
                        AuditEventType.CHANGE_EXECUTION_COMPLETED, EventOutcome.SUCCESS, recordResult, details);
            }

            ChangeRequest awaiting = commit(current, ChangeAction.AWAIT_VERIFICATION, actor,
                    AuditEventType.CHANGE_EXECUTION_COMPLETED, EventOutcome.SUCCESS, recordResult, details);
            if (result.verificationResults().isEmpty()) {
                return awaiting;
            }
            return verify(awaiting, actor, result.verificationResults());
        });
    }

    /**
     * PENDING_VERIFICATION → COMPLETED when every listed criterion passed; otherwise the
     * change is rolled back automatically with a single CHANGE_ROLLED_BACK event.
     *
     * @param results criterion name to pass/fail; criteria missing here count as failed
     */
    public ChangeRequest recordVerification(UUID id, Actor actor, Map<String, Boolean> results) {
        return withChange(id, () -> {
            ChangeRequest current = get(id);
            ChangeTransitions.next(current.getStatus(), ChangeAction.VERIFY);
            return verify(current, actor, results == null ? Map.of() : results);
        });
    }

    /**
     * Runs the rollback procedure and moves the request to ROLLED_BACK, whether or not
     * the procedure succeeded. A failed procedure is recorded and escalated.
     */
    public ChangeRequest rollback(UUID id, Actor actor, String reason) {
        return withChange(id, () -> {
            ChangeRequest current = get(id);
            ChangeTransitions.next(current.getStatus(), ChangeAction.ROLLBACK);
            return rollbackInternal(current, actor, reason, null);
        });
    }

    // ── Transition helpers ───────────────────────────────────────────────

    private ChangeRequest startReview(ChangeRequest current, Actor reviewer) {
        ChangeTransitions.next(current.getStatus(), ChangeAction.BEGIN_REVIEW);
        requireDistinct(reviewer, current.getRequestedBy(), "reviewer", "requester");
        return commit(current, ChangeAction.BEGIN_REVIEW, reviewer,
                AuditEventType.CHANGE_REQUEST_REVIEW_STARTED, EventOutcome.SUCCESS,
                r -> r.setReviewedBy(reviewer.id()), Map.of());
    }

    private ChangeRequest verify(ChangeRequest current, Actor actor, Map<String, Boolean> results) {
        List<String> failed = new ArrayList<>();
        for (String criterion : current.getVerificationCriteria()) {
            if (!Boolean.TRUE.equals(results.get(criterion))) {
                failed.add(criterion);
            }
        }
        results.forEach((criterion, passed) -> {
            if (!Boolean.TRUE.equals(passed) && !failed.contains(criterion)) {
                failed.add(criterion);
            }
        });

        Instant now = clock.instant();
        VerificationRecord verification = new VerificationRecord(actor.id(), now, failed.isEmpty(), results, failed);
        if (!failed.isEmpty()) {
            log.warn("Verification of change {} failed: {}", current.getChangeKey(), failed);
            return rollbackInternal(current, actor, "Verification failed: " + String.join(", ", failed), verification);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("results", new LinkedHashMap<>(results));
        return commit(current, ChangeAction.VERIFY, actor, AuditEventType.CHANGE_VERIFIED, EventOutcome.SUCCESS,
                r -> r.setVerification(verification), details);
    }

    private ChangeRequest rollbackInternal(ChangeRequest current, Actor actor, String reason,
                                           VerificationRecord verification) {
        RollbackReport report;
        try {
            report = rollbackExecutor.execute(current, reason);
        } catch (RuntimeException e) {
            log.error("Rollback procedure for change {} failed", current.getChangeKey(), e);
            report = RollbackReport.failure(e.getMessage());
        }

        Instant now = clock.instant();
        RollbackRecord record = new RollbackRecord(actor.id(), now, reason, true, report.successful(), report.detail());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason);
        details.put("rollbackExecuted", true);
        details.put("rollbackSuccessful", report.successful());
        details.put("detail", report.detail());
        if (verification != null) {
            details.put("failedCriteria", verification.failedCriteria());
        }

        ChangeRequest rolledBack = commit(current, ChangeAction.ROLLBACK, actor, AuditEventType.CHANGE_ROLLED_BACK,
                report.successful() ? EventOutcome.SUCCESS : EventOutcome.FAILURE,
                r -> {
                    if (verification != null) {
                        r.setVerification(verification);
                    }
                    r.setRollback(record);
                },
                details);

        if (metrics != null) {
            metrics.recordRollback(report.successful());
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("changeKey", rolledBack.getChangeKey());
        payload.put("reason", reason);
        payload.put("rollbackSuccessful", report.successful());
        if (report.successful()) {
            notifications.publish(new GovernanceAlert("change.rolled_back", AlertSeverity.WARNING,
                    rolledBack.getId().toString(), "Change " + rolledBack.getChangeKey() + " rolled back: " + reason,
                    payload, now));
        } else {
            log.error("Change {} is ROLLED_BACK but its rollback procedure failed: {}",
                    rolledBack.getChangeKey(), report.detail());
            notifications.publish(new GovernanceAlert("change.rollback_failed", AlertSeverity.CRITICAL,
                    rolledBack.getId().toString(),
                    "Rollback of change " + rolledBack.getChangeKey() + " failed: " + report.detail(),
                    payload, now));
        }
        return rolledBack;
    }

    private ChangeRequest schedule(ChangeRequest approved, Actor actor, Instant start, ChangeAction action) {
        Instant end = start.plus(properties.windowFor(approved.getRiskLevel()));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("scheduledStart", start.toString());
        details.put("scheduledEnd", end.toString());
        if (approved.getScheduledStart() != null) {
            details.put("previousStart", approved.getScheduledStart().toString());
            details.put("previousEnd", String.valueOf(approved.getScheduledEnd()));
        }
        AuditEventType type = action == ChangeAction.RESCHEDULE
                ? AuditEventType.CHANGE_REQUEST_RESCHEDULED : AuditEventType.CHANGE_REQUEST_SCHEDULED;
        return commit(approved, action, actor, type, EventOutcome.SUCCESS,
                r -> {
                    r.setScheduledStart(start);
                    r.setScheduledEnd(end);
                },
                details);
    }

    /**
     * Applies one transition (or, with a null action, records an event without changing state):
     * version-checked save, then the ledger event, reverting the save if the ledger refuses.
     */
    private ChangeRequest commit(ChangeRequest current, ChangeAction action, Actor actor, AuditEventType eventType,
                                 EventOutcome outcome, Consumer<ChangeRequest> mutation, Map<String, Object> details) {
        ChangeStatus from = current.getStatus();
        ChangeStatus to = action == null ? from : ChangeTransitions.next(from, action);

        UUID eventId = UUID.randomUUID();
        ChangeRequest updated = current.copy();
        mutation.accept(updated);
        updated.setStatus(to);
        updated.setUpdatedAt(clock.instant());
        updated.getLedgerEventIds().add(eventId);

        long expectedVersion = current.getVersion();
        store.save(updated, expectedVersion);

        try {
            ledger.append(event(eventType, eventId, updated, actor, outcome, from, to, details));
        } catch (RuntimeException e) {
            revert(current, updated.getVersion());
            throw e;
        }

        if (metrics != null && from != to) {
            metrics.recordChangeTransition(from.name(), to.name());
        }
        if (from != to) {
            log.info("Change {}: {} -> {} by {}", updated.getChangeKey(), from, to, actor);
        }
        return updated;
    }

    private void discard(ChangeRequest created) {
        try {
            store.delete(created.getId(), created.getVersion());
        } catch (ConflictException e) {
            log.error("Could not discard change {} after ledger failure: {}", created.getChangeKey(), e.getMessage());
        }
    }

    /**
     * Impact assessment and testing evidence as gate context: presence flags plus each
     * top-level entry under {@code impactAssessment.<name>} and {@code testingEvidence.<name>}.
     */
    private static Map<String, Object> evidenceContext(ChangeRequest request) {
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("impactAssessed", !request.getImpactAssessment().isEmpty());
        evidence.put("testingEvidenceProvided", !request.getTestingEvidence().isEmpty());
        request.getImpactAssessment().forEach((k, v) -> evidence.put("impactAssessment." + k, v));
        request.getTestingEvidence().forEach((k, v) -> evidence.put("testingEvidence." + k, v));
        return evidence;
    }

    private void revert(ChangeRequest previous, long currentVersion) {
        ChangeRequest restored = previous.copy();
        try {
            store.save(restored, currentVersion);
        } catch (ConflictException e) {
            log.error("Could not restore change {} after ledger failure: {}", previous.getChangeKey(), e.getMessage());
        }
    }

    private static AuditEventDraft event(AuditEventType type, UUID eventId, ChangeRequest request, Actor actor,
                                         EventOutcome outcome, ChangeStatus from, ChangeStatus to,
                                         Map<String, Object> details) {
        return AuditEventDraft.builder(type)
                .id(eventId)
                .actor(actor)
                .outcome(outcome)
                .resource("change_request", request.getId(), request.getChangeKey())
                .context("fromStatus", from == null ? null : from.name())
                .context("toStatus", to.name())
                .context("riskLevel", request.getRiskLevel() == null ? null : request.getRiskLevel().name())
                .context(details)
                .build();
    }

    private void requireDistinct(Actor actor, Actor requester, String role, String otherRole) {
        if (properties.isEnforceSeparationOfDuties() && requester != null && actor.id().equals(requester.id())) {
            throw new ValidationException("The " + role + " of a change must not be its " + otherRole
                    + " (" + actor.id() + ")");
        }
    }

    private void checkWindowStillOpen(ChangeRequest request, Instant start, Instant now) {
        Instant end = start.plus(properties.windowFor(request.getRiskLevel()));
        if (end.isBefore(now)) {
            throw new ValidationException("Requested window [" + start + ", " + end + "] has already elapsed");
        }
    }

    private static <T> T withChange(UUID id, Supplier<T> operation) {
        MdcContext.setChange(String.valueOf(id));
        try {
            return operation.get();
        } finally {
            MdcContext.clearChange();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

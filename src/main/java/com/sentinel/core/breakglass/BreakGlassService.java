package com.sentinel.core.breakglass;

import com.sentinel.core.error.ConflictException;
import com.sentinel.core.error.InvalidTransitionException;
import com.sentinel.core.error.NotFoundException;
import com.sentinel.core.error.ValidationException;
import com.sentinel.core.events.AlertSeverity;
import com.sentinel.core.events.GovernanceAlert;
import com.sentinel.core.events.NotificationPublisher;
import com.sentinel.core.gate.EvaluationRequest;
import com.sentinel.core.gate.GateDecision;
import com.sentinel.core.gate.GateEvaluator;
import com.sentinel.core.ledger.Actor;
import com.sentinel.core.ledger.AuditEventDraft;
import com.sentinel.core.ledger.AuditEventType;
import com.sentinel.core.ledger.EventOutcome;
import com.sentinel.core.ledger.Ledger;
import com.sentinel.core.logging.MdcContext;
import com.sentinel.core.policy.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Emergency overrides of the control policy layer.
 * <p>
 * A grant is requested by one person and approved by another; approval itself must
 * pass the break-glass entry gate, so an engaged HARD_STOP kill switch makes approval
 * impossible. Approved grants are time-bounded and require a post-incident review.
 */
@Service
public class BreakGlassService {

    private static final Logger log = LoggerFactory.getLogger(BreakGlassService.class);

    private final BreakGlassStore store;
    private final Ledger ledger;
    private final GateEvaluator gateEvaluator;
    private final NotificationPublisher notifications;
    private final Clock clock;
    private final BreakGlassProperties properties;

    public BreakGlassService(BreakGlassStore store, Ledger ledger, GateEvaluator gateEvaluator,
                             NotificationPublisher notifications, Clock clock, BreakGlassProperties properties) {
        this.store = store;
        this.ledger = ledger;
        this.gateEvaluator = gateEvaluator;
        this.notifications = notifications;
        this.clock = clock;
        this.properties = properties;
    }

    public BreakGlassGrant get(UUID id) {
        return store.load(id).orElseThrow(() -> new NotFoundException("Break-glass grant", id));
    }

    public List<BreakGlassGrant> list() {
        return store.list();
    }

    /**
     * Files a PENDING request.
     *
     * @param workflowId scope of the override, {@code null} for global
     * @param duration   requested window; defaults to the configured duration, capped at the maximum
     */
    public BreakGlassGrant request(String grantKey, String workflowId, BreakGlassReason reason, String justification,
                                   String incidentId, Duration duration, Actor requester) {
        List<String> violations = new ArrayList<>();
        if (grantKey == null || grantKey.isBlank()) {
            violations.add("grantKey is required");
        }
        if (reason == null) {
            violations.add("reason is required");
        }
        if (justification == null || justification.isBlank()) {
            violations.add("justification is required");
        }
        Duration window = duration != null ? duration : properties.getDefaultDuration();
        if (window.isNegative() || window.isZero()) {
            violations.add("duration must be positive");
        } else if (window.compareTo(properties.getMaxDuration()) > 0) {
            violations.add("duration exceeds the maximum of " + properties.getMaxDuration());
        }
        if (!violations.isEmpty()) {
            throw new ValidationException("Invalid break-glass request", violations);
        }

        Instant now = clock.instant();
        BreakGlassGrant grant = new BreakGlassGrant();
        grant.setId(UUID.randomUUID());
        grant.setGrantKey(grantKey);
        grant.setWorkflowId(workflowId);
        grant.setReason(reason);
        grant.setJustification(justification);
        grant.setIncidentId(incidentId);
        grant.setDuration(window);
        grant.setRequestedBy(requester);
        grant.setRequestedAt(now);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason.name());
        details.put("justification", justification);
        details.put("incidentId", incidentId);
        details.put("durationMinutes", window.toMinutes());
        ledger.append(event(AuditEventType.BREAK_GLASS_REQUESTED, grant, requester, EventOutcome.WARNING, details));
        store.save(grant, 0);

        log.warn("Break-glass {} requested by {} ({}, scope {})", grantKey, requester, reason, grant.scope());
        notifications.publish(new GovernanceAlert("break_glass.requested", AlertSeverity.WARNING,
                grant.getId().toString(), "Break-glass " + grantKey + " requested: " + justification,
                Map.of("reason", reason.name(), "requestedBy", requester.toString()), now));
        return grant;
    }

    /**
     * Approves a PENDING grant if the break-glass entry gate allows it. A blocking gate
     * outcome leaves the grant PENDING and is recorded as BREAK_GLASS_APPROVAL_BLOCKED.
     */
    public BreakGlassApproval approve(UUID id, Actor approver, String notes) {
        MdcContext.setGrant(id.toString());
        try {
            BreakGlassGrant current = get(id);
            requireStatus(current, BreakGlassStatus.PENDING, "approve");
            if (current.getRequestedBy() != null && approver.id().equals(current.getRequestedBy().id())) {
                throw new ValidationException("A break-glass grant must be approved by someone other than its requester");
            }

            EvaluationRequest gateRequest = EvaluationRequest.builder(properties.getEntryGateKey(), approver)
                    .context("grantKey", current.getGrantKey())
                    .context("reason", current.getReason().name())
                    .context("workflowId", current.getWorkflowId())
                    .context("incidentId", current.getIncidentId())
                    .context("durationMinutes", current.getDuration().toMinutes())
                    .requestId(current.getId().toString())
                    .scope(current.scope())
                    .build();
            GateDecision decision = gateEvaluator.evaluate(gateRequest);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("gateOutcome", decision.outcome().name());
            details.put("gateExecutionId", decision.gateExecutionId() == null ? null : decision.gateExecutionId().toString());
            details.put("notes", notes);

            if (decision.outcome().isBlocking()) {
                details.put("gateReason", decision.reason());
                ledger.append(event(AuditEventType.BREAK_GLASS_APPROVAL_BLOCKED, current, approver,
                        EventOutcome.BLOCKED, details));
                log.warn("Approval of break-glass {} refused by gate {}: {}",
                        current.getGrantKey(), properties.getEntryGateKey(), decision.reason());
                return new BreakGlassApproval(current, decision);
            }

            Instant now = clock.instant();
            BreakGlassGrant approved = commit(current, AuditEventType.BREAK_GLASS_APPROVED, approver,
                    EventOutcome.WARNING, g -> {
                        g.setStatus(BreakGlassStatus.APPROVED);
                        g.setApprovedBy(approver.id());
                        g.setApprovedAt(now);
                        g.setApprovalNotes(notes);
                        g.setApprovalGateExecutionId(decision.gateExecutionId());
                        g.setValidFrom(now);
                        g.setValidUntil(now.plus(g.getDuration()));
                    }, details);

            log.warn("Break-glass {} ACTIVE until {} (approved by {})",
                    approved.getGrantKey(), approved.getValidUntil(), approver);
            notifications.publish(new GovernanceAlert("break_glass.approved", AlertSeverity.CRITICAL,
                    approved.getId().toString(),
                    "Break-glass " + approved.getGrantKey() + " active until " + approved.getValidUntil(),
                    Map.of("approvedBy", approver.toString(), "scope", approved.scope().toString()), now));
            return new BreakGlassApproval(approved, decision);
        } finally {
            MdcContext.clearGrant();
        }
    }

    public BreakGlassGrant deny(UUID id, Actor actor, String reason) {
        BreakGlassGrant current = get(id);
        requireStatus(current, BreakGlassStatus.PENDING, "deny");
        Instant now = clock.instant();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason);
        BreakGlassGrant denied = commit(current, AuditEventType.BREAK_GLASS_DENIED, actor, EventOutcome.SUCCESS, g -> {
            g.setStatus(BreakGlassStatus.DENIED);
            g.setDeniedBy(actor.id());
            g.setDeniedAt(now);
            g.setDenialReason(reason);
        }, details);
        log.info("Break-glass {} denied by {}", denied.getGrantKey(), actor);
        return denied;
    }

    /**
     * Ends an approved grant early.
     */
    public BreakGlassGrant revoke(UUID id, Actor actor, String reason) {
        BreakGlassGrant current = get(id);
        requireStatus(current, BreakGlassStatus.APPROVED, "revoke");
        Instant now = clock.instant();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason);
        details.put("scheduledUntil", String.valueOf(current.getValidUntil()));
        BreakGlassGrant revoked = commit(current, AuditEventType.BREAK_GLASS_REVOKED, actor, EventOutcome.SUCCESS, g -> {
            g.setStatus(BreakGlassStatus.REVOKED);
            g.setRevokedBy(actor.id());
            g.setRevokedAt(now);
            g.setRevocationReason(reason);
            g.setValidUntil(now);
        }, details);
        log.info("Break-glass {} revoked by {}", revoked.getGrantKey(), actor);
        return revoked;
    }

    /**
     * Moves approved grants whose window has passed to EXPIRED.
     */
    public List<BreakGlassGrant> expireElapsed(Actor actor) {
        Instant now = clock.instant();
        List<BreakGlassGrant> expired = new ArrayList<>();
        for (BreakGlassGrant grant : store.list()) {
            if (grant.getStatus() != BreakGlassStatus.APPROVED || !grant.isElapsed(now)) {
                continue;
            }
            try {
                expired.add(commit(grant, AuditEventType.BREAK_GLASS_EXPIRED, actor, EventOutcome.SUCCESS,
                        g -> g.setStatus(BreakGlassStatus.EXPIRED),
                        Map.of("validUntil", String.valueOf(grant.getValidUntil()))));
                log.info("Break-glass {} expired", grant.getGrantKey());
            } catch (ConflictException e) {
                log.warn("Break-glass {} changed concurrently; skipping expiry: {}", grant.getGrantKey(), e.getMessage());
            }
        }
        return expired;
    }

    /**
     * Records the mandatory post-incident review of a grant that is no longer active.
     */
    public BreakGlassGrant completePostIncidentReview(UUID id, Actor reviewer, String notes) {
        BreakGlassGrant current = get(id);
        Instant now = clock.instant();
        boolean finished = current.getStatus() == BreakGlassStatus.EXPIRED
                || current.getStatus() == BreakGlassStatus.REVOKED
                || (current.getStatus() == BreakGlassStatus.APPROVED && current.isElapsed(now));
        if (!finished) {
            throw new InvalidTransitionException("Break-glass " + current.getGrantKey()
                    + " cannot be reviewed while " + current.getStatus());
        }
        if (current.isPostIncidentReviewCompleted()) {
            throw new InvalidTransitionException("Break-glass " + current.getGrantKey() + " was already reviewed");
        }
        if (notes == null || notes.isBlank()) {
            throw new ValidationException("Post-incident review notes are required");
        }
        return commit(current, AuditEventType.BREAK_GLASS_REVIEWED, reviewer, EventOutcome.SUCCESS, g -> {
            g.setPostIncidentReviewCompleted(true);
            g.setPostIncidentReviewedBy(reviewer.id());
            g.setPostIncidentReviewedAt(now);
            g.setPostIncidentNotes(notes);
        }, Map.of("notes", notes));
    }

    public boolean isActive(UUID id, Scope scope) {
        return store.load(id)
                .map(grant -> grant.isActive(clock.instant()) && grant.scope().covers(scope))
                .orElse(false);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private BreakGlassGrant commit(BreakGlassGrant current, AuditEventType type, Actor actor, EventOutcome outcome,
                                   Consumer<BreakGlassGrant> mutation, Map<String, Object> details) {
        BreakGlassGrant updated = current.copy();
        mutation.accept(updated);
        store.save(updated, current.getVersion());
        try {
            ledger.append(event(type, updated, actor, outcome, details));
        } catch (RuntimeException e) {
            try {
                store.save(current.copy(), updated.getVersion());
            } catch (ConflictException conflict) {
                log.error("Could not restore break-glass {} after ledger failure: {}",
                        current.getGrantKey(), conflict.getMessage());
            }
            throw e;
        }
        return updated;
    }

    private static void requireStatus(BreakGlassGrant grant, BreakGlassStatus expected, String verb) {
        if (grant.getStatus() != expected) {
            throw new InvalidTransitionException("Cannot " + verb + " break-glass " + grant.getGrantKey()
                    + " in state " + grant.getStatus());
        }
    }

    private static AuditEventDraft event(AuditEventType type, BreakGlassGrant grant, Actor actor,
                                         EventOutcome outcome, Map<String, Object> details) {
        return AuditEventDraft.builder(type)
                .actor(actor)
                .outcome(outcome)
                .resource("break_glass", grant.getId(), grant.getGrantKey())
                .context("status", grant.getStatus().name())
                .context("scope", grant.scope().toString())
                .context(details)
                .build();
    }
}

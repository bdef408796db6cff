package com.sentinel.core.breakglass;

import com.sentinel.core.error.InvalidTransitionException;
import com.sentinel.core.error.ValidationException;
import com.sentinel.core.events.AlertSeverity;
import com.sentinel.core.events.GovernanceAlert;
import com.sentinel.core.events.NotificationPublisher;
import com.sentinel.core.gate.EvaluationRequest;
import com.sentinel.core.gate.GateDecision;
import com.sentinel.core.gate.GateEvaluator;
import com.sentinel.core.gate.GateOutcome;
import com.sentinel.core.gate.GateProperties;
import com.sentinel.core.gate.InMemoryGateExecutionStore;
import com.sentinel.core.ledger.Actor;
import com.sentinel.core.ledger.AuditEvent;
import com.sentinel.core.ledger.AuditEventType;
import com.sentinel.core.ledger.EventHasher;
import com.sentinel.core.ledger.EventOutcome;
import com.sentinel.core.ledger.InMemoryLedgerStore;
import com.sentinel.core.ledger.Ledger;
import com.sentinel.core.policy.ControlPolicy;
import com.sentinel.core.policy.EnforcementGate;
import com.sentinel.core.policy.EnforcementMode;
import com.sentinel.core.policy.GateType;
import com.sentinel.core.policy.GovernanceProperties;
import com.sentinel.core.policy.InMemoryGovernanceRegistry;
import com.sentinel.core.policy.KillSwitch;
import com.sentinel.core.policy.KillSwitchMode;
import com.sentinel.core.policy.KillSwitchTrigger;
import com.sentinel.core.policy.PolicyAction;
import com.sentinel.core.policy.Scope;
import com.sentinel.core.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class BreakGlassServiceTest {

    private static final Actor ONCALL = Actor.user("dana");
    private static final Actor COMMANDER = Actor.user("erin");

    private MutableClock clock;
    private InMemoryGovernanceRegistry registry;
    private Ledger ledger;
    private InMemoryBreakGlassStore store;
    private NotificationPublisher notifications;
    private GateEvaluator gateEvaluator;
    private BreakGlassService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-03T02:15:00Z");
        registry = new InMemoryGovernanceRegistry(new GovernanceProperties());
        ledger = new Ledger(new InMemoryLedgerStore(), new EventHasher(), clock, null);
        store = new InMemoryBreakGlassStore();
        notifications = mock(NotificationPublisher.class);

        Map<String, Object> missingIncident = new HashMap<>();
        missingIncident.put("incidentId", null);
        registry.savePolicy(new ControlPolicy("require-incident", "require-incident", "Incident required",
                PolicyAction.DENY, missingIncident, Map.of(), 10, true, null));
        registry.savePolicy(new ControlPolicy("allow-break-glass", "allow-break-glass", "Allow break-glass",
                PolicyAction.ALLOW, Map.of(), Map.of(), 100, true, null));
        registry.saveGate(new EnforcementGate("break-glass-entry", "break-glass-entry", "Break-glass entry",
                GateType.BREAK_GLASS_ENTRY, List.of("require-incident", "allow-break-glass"),
                EnforcementMode.BLOCKING, true, true, false, false, true, Scope.GLOBAL, null, true));

        registry.savePolicy(new ControlPolicy("freeze", "freeze", "Change freeze",
                PolicyAction.DENY, Map.of(), Map.of(), 10, true, null));
        registry.saveGate(new EnforcementGate("deploy", "deploy", "Deploy", GateType.PRE_EXECUTION,
                List.of("freeze"), EnforcementMode.BLOCKING, true, true, false, false, true, Scope.GLOBAL, null, true));

        gateEvaluator = new GateEvaluator(registry, ledger, new InMemoryGateExecutionStore(), clock,
                new GateProperties(), notifications, new BreakGlassOverrides(store), null);
        service = new BreakGlassService(store, ledger, gateEvaluator, notifications, clock, new BreakGlassProperties());
    }

    @AfterEach
    void tearDown() {
        gateEvaluator.shutdown();
    }

    private BreakGlassGrant requestGrant(String incidentId) {
        return service.request("BG-1", "checkout", BreakGlassReason.P0_INCIDENT,
                "Checkout down, hotfix must bypass freeze", incidentId, Duration.ofHours(1), ONCALL);
    }

    private BreakGlassGrant activeGrant() {
        BreakGlassGrant grant = requestGrant("INC-7");
        BreakGlassApproval approval = service.approve(grant.getId(), COMMANDER, "approved on bridge");
        assertTrue(approval.approved());
        return approval.grant();
    }

    private GateDecision deployWith(BreakGlassGrant grant, String workflowId) {
        return gateEvaluator.evaluate(EvaluationRequest.builder("deploy", ONCALL)
                .scope(Scope.workflow(workflowId))
                .breakGlassGrant(grant.getId())
                .build());
    }

    private AuditEvent lastEvent() {
        return ledger.tip().orElseThrow();
    }

    @Nested
    @DisplayName("request")
    class RequestTests {

        @Test
        @DisplayName("a request is PENDING, audited and announced")
        void requestIsPending() {
            BreakGlassGrant grant = requestGrant("INC-7");

            assertEquals(BreakGlassStatus.PENDING, grant.getStatus());
            assertEquals(Duration.ofHours(1), grant.getDuration());
            assertEquals(AuditEventType.BREAK_GLASS_REQUESTED, lastEvent().eventType());
            assertEquals("INC-7", lastEvent().context().get("incidentId"));
            verify(notifications).publish(argThat(a -> a.alertType().equals("break_glass.requested")));
        }

        @Test
        @DisplayName("duration defaults to two hours")
        void defaultDuration() {
            BreakGlassGrant grant = service.request("BG-2", null, BreakGlassReason.SYSTEM_FAILURE,
                    "Primary database unreachable", "INC-8", null, ONCALL);

            assertEquals(Duration.ofHours(2), grant.getDuration());
            assertEquals(Scope.GLOBAL, grant.scope());
        }

        @Test
        @DisplayName("duration above the maximum and missing justification are rejected")
        void validation() {
            ValidationException ex = assertThrows(ValidationException.class,
                    () -> service.request("BG-3", null, BreakGlassReason.DATA_LOSS, " ", null,
                            Duration.ofHours(9), ONCALL));

            assertEquals(2, ex.violations().size());
            assertTrue(ledger.tip().isEmpty());
        }
    }

    @Nested
    @DisplayName("approval")
    class ApprovalTests {

        @Test
        @DisplayName("approval opens a window of the requested duration")
        void approveOpensWindow() {
            BreakGlassGrant grant = activeGrant();

            assertEquals(BreakGlassStatus.APPROVED, grant.getStatus());
            assertEquals(clock.instant(), grant.getValidFrom());
            assertEquals(clock.instant().plus(Duration.ofHours(1)), grant.getValidUntil());
            assertNotNull(grant.getApprovalGateExecutionId());
            assertEquals(AuditEventType.BREAK_GLASS_APPROVED, lastEvent().eventType());
            assertTrue(service.isActive(grant.getId(), Scope.workflow("checkout")));

            ArgumentCaptor<GovernanceAlert> alerts = ArgumentCaptor.forClass(GovernanceAlert.class);
            verify(notifications, atLeastOnce()).publish(alerts.capture());
            assertTrue(alerts.getAllValues().stream().anyMatch(a ->
                    a.alertType().equals("break_glass.approved") && a.severity() == AlertSeverity.CRITICAL));
        }

        @Test
        @DisplayName("the requester cannot approve their own grant")
        void selfApproval() {
            BreakGlassGrant grant = requestGrant("INC-7");

            assertThrows(ValidationException.class, () -> service.approve(grant.getId(), ONCALL, "me"));
            assertEquals(BreakGlassStatus.PENDING, service.get(grant.getId()).getStatus());
        }

        @Test
        @DisplayName("the entry gate refuses a grant without an incident")
        void entryGateRequiresIncident() {
            BreakGlassGrant grant = requestGrant(null);

            BreakGlassApproval approval = service.approve(grant.getId(), COMMANDER, "ok");

            assertFalse(approval.approved());
            assertEquals(GateOutcome.BLOCK, approval.decision().outcome());
            assertEquals(BreakGlassStatus.PENDING, service.get(grant.getId()).getStatus());
            assertEquals(AuditEventType.BREAK_GLASS_APPROVAL_BLOCKED, lastEvent().eventType());
            assertEquals(EventOutcome.BLOCKED, lastEvent().outcome());
        }

        @Test
        @DisplayName("an engaged hard stop makes approval impossible")
        void hardStopBlocksApproval() {
            registry.saveKillSwitch(KillSwitch.define("global-halt", "Global halt", Scope.GLOBAL, KillSwitchMode.HARD_STOP)
                    .activate("ops", "breach", KillSwitchTrigger.MANUAL, null, clock.instant(), null));
            BreakGlassGrant grant = requestGrant("INC-7");

            BreakGlassApproval approval = service.approve(grant.getId(), COMMANDER, "ok");

            assertFalse(approval.approved());
            assertEquals(GateOutcome.HARD_STOP, approval.decision().outcome());
        }

        @Test
        @DisplayName("a denied grant cannot be approved later")
        void denyIsFinal() {
            BreakGlassGrant grant = requestGrant("INC-7");
            BreakGlassGrant denied = service.deny(grant.getId(), COMMANDER, "use the normal process");

            assertEquals(BreakGlassStatus.DENIED, denied.getStatus());
            assertThrows(InvalidTransitionException.class, () -> service.approve(grant.getId(), COMMANDER, "ok"));
        }
    }

    @Nested
    @DisplayName("override")
    class OverrideTests {

        @Test
        @DisplayName("an active grant bypasses a denying policy in its scope")
        void bypassesPolicies() {
            BreakGlassGrant grant = activeGrant();

            assertEquals(GateOutcome.ALLOW, deployWith(grant, "checkout").outcome());
            assertEquals(GateOutcome.BLOCK, deployWith(grant, "billing").outcome());
        }

        @Test
        @DisplayName("an active grant never bypasses a hard stop")
        void doesNotBypassKillSwitch() {
            BreakGlassGrant grant = activeGrant();
            registry.saveKillSwitch(KillSwitch.define("global-halt", "Global halt", Scope.GLOBAL, KillSwitchMode.HARD_STOP)
                    .activate("ops", "breach", KillSwitchTrigger.MANUAL, null, clock.instant(), null));

            assertEquals(GateOutcome.HARD_STOP, deployWith(grant, "checkout").outcome());
        }

        @Test
        @DisplayName("the grant stops working once its window has passed")
        void elapsedGrant() {
            BreakGlassGrant grant = activeGrant();
            clock.advance(Duration.ofMinutes(61));

            assertFalse(service.isActive(grant.getId(), Scope.workflow("checkout")));
            assertEquals(GateOutcome.BLOCK, deployWith(grant, "checkout").outcome());
        }

        @Test
        @DisplayName("revocation ends the grant immediately")
        void revoke() {
            BreakGlassGrant grant = activeGrant();
            clock.advance(Duration.ofMinutes(5));

            BreakGlassGrant revoked = service.revoke(grant.getId(), COMMANDER, "hotfix deployed");

            assertEquals(BreakGlassStatus.REVOKED, revoked.getStatus());
            assertEquals(clock.instant(), revoked.getValidUntil());
            clock.advance(Duration.ofSeconds(1));
            assertEquals(GateOutcome.BLOCK, deployWith(grant, "checkout").outcome());
        }
    }

    @Nested
    @DisplayName("expiry and post-incident review")
    class ReviewTests {

        @Test
        @DisplayName("elapsed grants are expired in one sweep")
        void expireElapsed() {
            BreakGlassGrant grant = activeGrant();
            clock.advance(Duration.ofHours(2));

            List<BreakGlassGrant> expired = service.expireElapsed(Actor.system("sweeper"));

            assertEquals(1, expired.size());
            assertEquals(BreakGlassStatus.EXPIRED, service.get(grant.getId()).getStatus());
            assertEquals(AuditEventType.BREAK_GLASS_EXPIRED, lastEvent().eventType());
            assertTrue(service.expireElapsed(Actor.system("sweeper")).isEmpty());
        }

        @Test
        @DisplayName("review is only possible once the grant is over, and only once")
        void postIncidentReview() {
            BreakGlassGrant grant = activeGrant();
            assertThrows(InvalidTransitionException.class,
                    () -> service.completePostIncidentReview(grant.getId(), COMMANDER, "too early"));

            service.revoke(grant.getId(), COMMANDER, "done");
            assertThrows(ValidationException.class,
                    () -> service.completePostIncidentReview(grant.getId(), COMMANDER, ""));

            BreakGlassGrant reviewed = service.completePostIncidentReview(grant.getId(), COMMANDER,
                    "Freeze bypass justified; add canary to hotfix path");
            assertTrue(reviewed.isPostIncidentReviewCompleted());
            assertEquals(AuditEventType.BREAK_GLASS_REVIEWED, lastEvent().eventType());
            assertThrows(InvalidTransitionException.class,
                    () -> service.completePostIncidentReview(grant.getId(), COMMANDER, "again"));
        }

        @Test
        @DisplayName("the whole grant lifecycle leaves a verifiable chain")
        void chainIntact() {
            BreakGlassGrant grant = activeGrant();
            deployWith(grant, "checkout");
            service.revoke(grant.getId(), COMMANDER, "done");

            assertTrue(ledger.verifyChain().valid());
        }
    }
}

package com.sentinel.core.policy;

import com.sentinel.core.error.InvalidTransitionException;
import com.sentinel.core.error.NotFoundException;
import com.sentinel.core.error.PolicyEvaluationException;
import com.sentinel.core.ledger.Actor;
import com.sentinel.core.ledger.AuditEventType;
import com.sentinel.core.ledger.EventHasher;
import com.sentinel.core.ledger.InMemoryLedgerStore;
import com.sentinel.core.ledger.Ledger;
import com.sentinel.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ControlPolicyServiceTest {

    private static final Actor ADMIN = Actor.user("governance-admin");

    private InMemoryGovernanceRegistry registry;
    private Ledger ledger;
    private ControlPolicyService service;

    @BeforeEach
    void setUp() {
        registry = new InMemoryGovernanceRegistry(new GovernanceProperties());
        ledger = new Ledger(new InMemoryLedgerStore(), new EventHasher(), MutableClock.at("2026-03-01T09:00:00Z"), null);
        service = new ControlPolicyService(registry, ledger);
    }

    private static ControlPolicy denyPii() {
        return new ControlPolicy("deny-pii", "deny-pii", "Deny PII export", PolicyAction.DENY,
                Map.of("containsPii", true), Map.of(), 10, true, null);
    }

    @Test
    @DisplayName("register stores the policy and records it in the ledger")
    void register() {
        service.register(denyPii(), ADMIN);

        assertTrue(registry.policy("deny-pii").isPresent());
        assertEquals(AuditEventType.POLICY_REGISTERED, ledger.tip().orElseThrow().eventType());
    }

    @Test
    @DisplayName("register rejects conditions that do not compile")
    void registerRejectsMalformedConditions() {
        ControlPolicy broken = new ControlPolicy("broken", "broken", "Broken", PolicyAction.DENY,
                Map.of("amount", Map.of("$gt", 10)), Map.of(), 10, true, null);

        assertThrows(PolicyEvaluationException.class, () -> service.register(broken, ADMIN));
        assertTrue(registry.policy("broken").isEmpty());
        assertTrue(ledger.tip().isEmpty());
    }

    @Test
    @DisplayName("deactivate is a soft delete")
    void deactivateIsSoftDelete() {
        service.register(denyPii(), ADMIN);

        ControlPolicy off = service.deactivate("deny-pii", ADMIN, "Superseded");

        assertFalse(off.active());
        assertFalse(registry.policy("deny-pii").orElseThrow().active());
        assertEquals(AuditEventType.POLICY_DEACTIVATED, ledger.tip().orElseThrow().eventType());
        assertThrows(InvalidTransitionException.class, () -> service.deactivate("deny-pii", ADMIN, "again"));
    }

    @Test
    @DisplayName("deactivate of an unknown policy is not found")
    void deactivateUnknown() {
        assertThrows(NotFoundException.class, () -> service.deactivate("ghost", ADMIN, "x"));
    }
}

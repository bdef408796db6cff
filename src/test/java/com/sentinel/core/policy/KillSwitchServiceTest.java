package com.sentinel.core.policy;

import com.sentinel.core.error.InvalidTransitionException;
import com.sentinel.core.error.NotFoundException;
import com.sentinel.core.error.ValidationException;
import com.sentinel.core.events.AlertSeverity;
import com.sentinel.core.events.GovernanceAlert;
import com.sentinel.core.events.NotificationPublisher;
import com.sentinel.core.ledger.Actor;
import com.sentinel.core.ledger.AuditEvent;
import com.sentinel.core.ledger.AuditEventType;
import com.sentinel.core.ledger.EventHasher;
import com.sentinel.core.ledger.InMemoryLedgerStore;
import com.sentinel.core.ledger.Ledger;
import com.sentinel.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class KillSwitchServiceTest {

    private static final Actor OPERATOR = Actor.user("ops-lead");

    private MutableClock clock;
    private InMemoryGovernanceRegistry registry;
    private Ledger ledger;
    private NotificationPublisher notifications;
    private KillSwitchService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T09:00:00Z");
        registry = new InMemoryGovernanceRegistry(new GovernanceProperties());
        ledger = new Ledger(new InMemoryLedgerStore(), new EventHasher(), clock, null);
        notifications = mock(NotificationPublisher.class);
        service = new KillSwitchService(registry, ledger, clock, notifications, null);
        service.register("global-halt", "Global halt", Scope.GLOBAL, KillSwitchMode.HARD_STOP, Actor.system("seed"));
        service.register("payments-read-only", "Payments read-only", Scope.workflow("payments"),
                KillSwitchMode.READ_ONLY, Actor.system("seed"));
    }

    private List<AuditEventType> ledgerTypes() {
        return ledger.latest(100).stream().map(AuditEvent::eventType).toList();
    }

    @Nested
    @DisplayName("activate")
    class ActivateTests {

        @Test
        @DisplayName("hard stop activation is recorded and raises a critical alert")
        void hardStopRaisesCriticalAlert() {
            KillSwitch active = service.activate("global-halt", OPERATOR, "Runaway agent",
                    KillSwitchTrigger.INCIDENT, "INC-42", null);

            assertTrue(active.active());
            assertEquals("ops-lead", active.activatedBy());
            assertEquals("INC-42", active.incidentId());
            assertTrue(registry.killSwitch("global-halt").orElseThrow().active());
            assertEquals(AuditEventType.KILL_SWITCH_ACTIVATED, ledgerTypes().get(0));

            ArgumentCaptor<GovernanceAlert> alert = ArgumentCaptor.forClass(GovernanceAlert.class);
            verify(notifications).publish(alert.capture());
            assertEquals("kill_switch.hard_stop", alert.getValue().alertType());
            assertEquals(AlertSeverity.CRITICAL, alert.getValue().severity());
        }

        @Test
        @DisplayName("non-hard-stop activation raises a warning alert")
        void otherModesWarn() {
            service.activate("payments-read-only", OPERATOR, "Reconciliation", KillSwitchTrigger.MANUAL, null, null);

            ArgumentCaptor<GovernanceAlert> alert = ArgumentCaptor.forClass(GovernanceAlert.class);
            verify(notifications).publish(alert.capture());
            assertEquals(AlertSeverity.WARNING, alert.getValue().severity());
        }

        @Test
        @DisplayName("a reason is mandatory")
        void reasonRequired() {
            assertThrows(ValidationException.class,
                    () -> service.activate("global-halt", OPERATOR, " ", KillSwitchTrigger.MANUAL, null, null));
            assertFalse(registry.killSwitch("global-halt").orElseThrow().active());
        }

        @Test
        @DisplayName("activating an engaged switch is refused")
        void alreadyActive() {
            service.activate("global-halt", OPERATOR, "first", KillSwitchTrigger.MANUAL, null, null);
            assertThrows(InvalidTransitionException.class,
                    () -> service.activate("global-halt", OPERATOR, "second", KillSwitchTrigger.MANUAL, null, null));
        }

        @Test
        @DisplayName("unknown key is not found")
        void unknownKey() {
            assertThrows(NotFoundException.class,
                    () -> service.activate("nope", OPERATOR, "x", KillSwitchTrigger.MANUAL, null, null));
        }
    }

    @Nested
    @DisplayName("deactivate and expiry")
    class DeactivateTests {

        @Test
        @DisplayName("deactivation keeps the switch and records resolution notes")
        void deactivateKeepsHistory() {
            service.activate("global-halt", OPERATOR, "Runaway agent", KillSwitchTrigger.INCIDENT, null, null);
            clock.advance(Duration.ofMinutes(30));

            KillSwitch off = service.deactivate("global-halt", OPERATOR, "Agent contained");

            assertFalse(off.active());
            assertEquals("Agent contained", off.resolutionNotes());
            assertNotNull(off.activatedAt());
            assertEquals(2, service.list().size());
            assertEquals(AuditEventType.KILL_SWITCH_DEACTIVATED, ledgerTypes().get(0));
        }

        @Test
        @DisplayName("deactivating an idle switch is refused")
        void deactivateIdle() {
            assertThrows(InvalidTransitionException.class,
                    () -> service.deactivate("global-halt", OPERATOR, "n/a"));
        }

        @Test
        @DisplayName("switches past their auto-deactivate time stop applying and are released")
        void autoDeactivate() {
            service.activate("payments-read-only", OPERATOR, "Batch window", KillSwitchTrigger.AUTOMATED,
                    null, Duration.ofMinutes(15));
            KillSwitch engaged = registry.killSwitch("payments-read-only").orElseThrow();
            assertTrue(engaged.isEffective(clock.instant()));

            clock.advance(Duration.ofMinutes(15));
            assertFalse(engaged.isEffective(clock.instant()));
            assertTrue(engaged.isExpired(clock.instant()));

            List<KillSwitch> released = service.releaseExpired(Actor.system("scheduler"));
            assertEquals(1, released.size());
            assertFalse(registry.killSwitch("payments-read-only").orElseThrow().active());
        }
    }

    @Test
    @DisplayName("duplicate registration is rejected")
    void duplicateRegistration() {
        assertThrows(ValidationException.class, () -> service.register("global-halt", "again", Scope.GLOBAL,
                KillSwitchMode.DEGRADE, OPERATOR));
    }
}

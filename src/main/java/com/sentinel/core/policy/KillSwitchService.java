package com.sentinel.core.policy;

import com.sentinel.core.error.NotFoundException;
import com.sentinel.core.error.ValidationException;
import com.sentinel.core.events.AlertSeverity;
import com.sentinel.core.events.GovernanceAlert;
import com.sentinel.core.events.NotificationPublisher;
import com.sentinel.core.ledger.Actor;
import com.sentinel.core.ledger.AuditEventDraft;
import com.sentinel.core.ledger.AuditEventType;
import com.sentinel.core.ledger.EventOutcome;
import com.sentinel.core.ledger.Ledger;
import com.sentinel.core.metrics.SentinelMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Activates and deactivates kill switches.
 * <p>
 * Every state change is written to the ledger. A hard-stop activation also raises a
 * critical alert. The registry update happens first and is not rolled back if the
 * ledger write fails: an engaged safety control is preferred over a missing one.
 */
@Service
public class KillSwitchService {

    private static final Logger log = LoggerFactory.getLogger(KillSwitchService.class);

    private final GovernanceRegistry registry;
    private final Ledger ledger;
    private final Clock clock;
    private final NotificationPublisher notifications;
    private final SentinelMetrics metrics;

    private final Object mutationLock = new Object();

    public KillSwitchService(GovernanceRegistry registry, Ledger ledger, Clock clock,
                             NotificationPublisher notifications,
                             @Autowired(required = false) SentinelMetrics metrics) {
        this.registry = registry;
        this.ledger = ledger;
        this.clock = clock;
        this.notifications = notifications;
        this.metrics = metrics;
    }

    public List<KillSwitch> list() {
        return registry.killSwitches();
    }

    public KillSwitch register(String key, String name, Scope scope, KillSwitchMode mode, Actor actor) {
        KillSwitch created;
        synchronized (mutationLock) {
            if (registry.killSwitch(key).isPresent()) {
                throw new ValidationException("Kill switch " + key + " already exists");
            }
            created = KillSwitch.define(key, name, scope, mode);
            registry.saveKillSwitch(created);
        }
        ledger.append(draft(AuditEventType.KILL_SWITCH_REGISTERED, created, actor, EventOutcome.SUCCESS)
                .context("mode", mode.name())
                .context("scope", created.scope().toString())
                .build());
        log.info("Registered kill switch {} ({}, {})", key, mode, created.scope());
        return created;
    }

    /**
     * Engages a kill switch.
     *
     * @param autoDeactivateAfter optional lifetime after which the switch stops applying
     */
    public KillSwitch activate(String key, Actor actor, String reason, KillSwitchTrigger trigger,
                               String incidentId, Duration autoDeactivateAfter) {
        Instant now = clock.instant();
        Instant autoDeactivateAt = autoDeactivateAfter == null ? null : now.plus(autoDeactivateAfter);

        KillSwitch activated;
        synchronized (mutationLock) {
            KillSwitch current = registry.killSwitch(key)
                    .orElseThrow(() -> new NotFoundException("Kill switch", key));
            activated = current.activate(actor.id(), reason, trigger, incidentId, now, autoDeactivateAt);
            registry.saveKillSwitch(activated);
        }

        log.warn("Kill switch {} ACTIVATED by {} (mode {}, scope {}): {}",
                key, actor, activated.mode(), activated.scope(), reason);
        if (metrics != null) {
            metrics.recordKillSwitchActivation(activated.mode().name());
        }

        ledger.append(draft(AuditEventType.KILL_SWITCH_ACTIVATED, activated, actor, EventOutcome.WARNING)
                .context("mode", activated.mode().name())
                .context("scope", activated.scope().toString())
                .context("trigger", activated.trigger().name())
                .context("reason", reason)
                .context("incidentId", incidentId)
                .context("autoDeactivateAt", autoDeactivateAt == null ? null : autoDeactivateAt.toString())
                .build());

        boolean hardStop = activated.mode() == KillSwitchMode.HARD_STOP;
        notifications.publish(new GovernanceAlert(
                hardStop ? "kill_switch.hard_stop" : "kill_switch.activated",
                hardStop ? AlertSeverity.CRITICAL : AlertSeverity.WARNING,
                activated.key(),
                "Kill switch " + activated.key() + " activated (" + activated.mode() + "): " + reason,
                Map.of("mode", activated.mode().name(), "scope", activated.scope().toString(),
                        "activatedBy", actor.toString()),
                now));
        return activated;
    }

    public KillSwitch deactivate(String key, Actor actor, String resolutionNotes) {
        Instant now = clock.instant();
        KillSwitch deactivated;
        synchronized (mutationLock) {
            KillSwitch current = registry.killSwitch(key)
                    .orElseThrow(() -> new NotFoundException("Kill switch", key));
            deactivated = current.deactivate(actor.id(), resolutionNotes, now);
            registry.saveKillSwitch(deactivated);
        }

        log.info("Kill switch {} deactivated by {}", key, actor);
        ledger.append(draft(AuditEventType.KILL_SWITCH_DEACTIVATED, deactivated, actor, EventOutcome.SUCCESS)
                .context("mode", deactivated.mode().name())
                .context("resolutionNotes", resolutionNotes)
                .context("activeSince", deactivated.activatedAt() == null ? null : deactivated.activatedAt().toString())
                .build());
        return deactivated;
    }

    /**
     * Formally deactivates switches whose auto-deactivate time has passed.
     * Such switches already stopped applying to evaluations; this records the fact.
     */
    public List<KillSwitch> releaseExpired(Actor actor) {
        Instant now = clock.instant();
        List<KillSwitch> released = new ArrayList<>();
        for (KillSwitch ks : registry.killSwitches()) {
            if (ks.isExpired(now)) {
                released.add(deactivate(ks.key(), actor, "Auto-deactivated at " + ks.autoDeactivateAt()));
            }
        }
        return released;
    }

    private static AuditEventDraft.Builder draft(AuditEventType type, KillSwitch ks, Actor actor, EventOutcome outcome) {
        return AuditEventDraft.builder(type)
                .actor(actor)
                .outcome(outcome)
                .resource("kill_switch", ks.id(), ks.key());
    }
}

package com.sentinel.core.policy;

import com.sentinel.core.error.InvalidTransitionException;
import com.sentinel.core.error.ValidationException;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Highest-precedence control that halts or degrades operations in its scope.
 * <p>
 * Immutable: {@link #activate} and {@link #deactivate} return the next state.
 * Kill switches are never deleted.
 *
 * @param id               identity
 * @param key              unique, human-friendly key
 * @param name             display name
 * @param scope            global or workflow/capability scope
 * @param mode             what the switch does while active
 * @param trigger          what caused the most recent activation
 * @param active           whether the switch is engaged
 * @param activatedAt      most recent activation time
 * @param activatedBy      most recent activating actor
 * @param deactivatedAt    most recent deactivation time
 * @param deactivatedBy    most recent deactivating actor
 * @param autoDeactivateAt time after which an active switch stops applying (nullable)
 * @param reason           mandatory reason for the most recent activation
 * @param resolutionNotes  notes recorded on deactivation
 * @param incidentId       related incident reference (nullable)
 */
public record KillSwitch(
    UUID id,
    String key,
    String name,
    Scope scope,
    KillSwitchMode mode,
    KillSwitchTrigger trigger,
    boolean active,
    Instant activatedAt,
    String activatedBy,
    Instant deactivatedAt,
    String deactivatedBy,
    Instant autoDeactivateAt,
    String reason,
    String resolutionNotes,
    String incidentId
) {

    public KillSwitch {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        scope = scope == null ? Scope.GLOBAL : scope;
        trigger = trigger == null ? KillSwitchTrigger.MANUAL : trigger;
    }

    /**
     * A new, inactive kill switch.
     */
    public static KillSwitch define(String key, String name, Scope scope, KillSwitchMode mode) {
        return new KillSwitch(UUID.randomUUID(), key, name, scope, mode, KillSwitchTrigger.MANUAL,
                false, null, null, null, null, null, null, null, null);
    }

    public KillSwitch activate(String actorId, String activationReason, KillSwitchTrigger cause,
                               String incident, Instant at, Instant autoDeactivate) {
        if (isEffective(at)) {
            throw new InvalidTransitionException("Kill switch " + key + " is already active");
        }
        if (activationReason == null || activationReason.isBlank()) {
            throw new ValidationException("A reason is required to activate kill switch " + key);
        }
        if (autoDeactivate != null && !autoDeactivate.isAfter(at)) {
            throw new ValidationException("Auto-deactivate time must lie in the future");
        }
        return new KillSwitch(id, key, name, scope, mode, cause == null ? KillSwitchTrigger.MANUAL : cause,
                true, at, actorId, null, null, autoDeactivate, activationReason, null, incident);
    }

    public KillSwitch deactivate(String actorId, String notes, Instant at) {
        if (!active) {
            throw new InvalidTransitionException("Kill switch " + key + " is not active");
        }
        return new KillSwitch(id, key, name, scope, mode, trigger, false, activatedAt, activatedBy,
                at, actorId, autoDeactivateAt, reason, notes, incidentId);
    }

    /**
     * Active and not yet past its auto-deactivate time.
     */
    public boolean isEffective(Instant now) {
        return active && (autoDeactivateAt == null || now.isBefore(autoDeactivateAt));
    }

    /**
     * Active, but its auto-deactivate time has passed.
     */
    public boolean isExpired(Instant now) {
        return active && autoDeactivateAt != null && !now.isBefore(autoDeactivateAt);
    }

    public boolean appliesTo(Scope target) {
        return scope.covers(target);
    }
}

package com.sentinel.core.gate;

import com.sentinel.core.policy.Scope;

import java.time.Instant;
import java.util.UUID;

/**
 * Lookup of emergency (break-glass) grants. An active grant lets a request
 * bypass control policies; it never bypasses kill switches.
 */
public interface EmergencyOverrides {

    /**
     * True when the grant is approved, inside its validity window at {@code now},
     * and covers {@code scope}.
     */
    boolean isActive(UUID grantId, Scope scope, Instant now);
}

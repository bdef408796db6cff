package com.sentinel.core.breakglass;

import com.sentinel.core.gate.EmergencyOverrides;
import com.sentinel.core.policy.Scope;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;

/**
 * Lets the gate evaluator honour approved break-glass grants. Reads the store
 * directly so the evaluator does not depend on {@link BreakGlassService}.
 */
@Component
public class BreakGlassOverrides implements EmergencyOverrides {

    private final BreakGlassStore store;

    public BreakGlassOverrides(BreakGlassStore store) {
        this.store = store;
    }

    @Override
    public boolean isActive(UUID grantId, Scope scope, Instant now) {
        return store.load(grantId)
                .map(grant -> grant.isActive(now) && grant.scope().covers(scope))
                .orElse(false);
    }
}

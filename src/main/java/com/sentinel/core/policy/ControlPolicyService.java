package com.sentinel.core.policy;

import com.sentinel.core.error.InvalidTransitionException;
import com.sentinel.core.error.NotFoundException;
import com.sentinel.core.error.ValidationException;
import com.sentinel.core.ledger.Actor;
import com.sentinel.core.ledger.AuditEventDraft;
import com.sentinel.core.ledger.AuditEventType;
import com.sentinel.core.ledger.Ledger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Registers and soft-deletes control policies. Policies are never removed so
 * that past gate executions remain reproducible.
 */
@Service
public class ControlPolicyService {

    private static final Logger log = LoggerFactory.getLogger(ControlPolicyService.class);

    private final GovernanceRegistry registry;
    private final Ledger ledger;

    public ControlPolicyService(GovernanceRegistry registry, Ledger ledger) {
        this.registry = registry;
        this.ledger = ledger;
    }

    /**
     * Stores a new policy after checking that its conditions compile.
     */
    public ControlPolicy register(ControlPolicy policy, Actor actor) {
        if (registry.policy(policy.id()).isPresent()) {
            throw new ValidationException("Control policy " + policy.id() + " already exists");
        }
        ConditionParser.compile(policy.conditions());
        ConditionParser.compileTriggers(policy.autoDenyConditions());

        registry.savePolicy(policy);
        ledger.append(AuditEventDraft.builder(AuditEventType.POLICY_REGISTERED)
                .actor(actor)
                .resource("control_policy", policy.id(), policy.key())
                .context("action", policy.action().name())
                .context("priority", policy.priority())
                .context("conditions", policy.conditions())
                .context("autoDenyConditions", policy.autoDenyConditions())
                .build());
        log.info("Registered control policy {} ({} at priority {})", policy.key(), policy.action(), policy.priority());
        return policy;
    }

    public ControlPolicy deactivate(String policyId, Actor actor, String reason) {
        ControlPolicy current = registry.policy(policyId)
                .orElseThrow(() -> new NotFoundException("Control policy", policyId));
        if (!current.active()) {
            throw new InvalidTransitionException("Control policy " + policyId + " is already inactive");
        }

        ControlPolicy deactivated = current.deactivate();
        registry.savePolicy(deactivated);
        ledger.append(AuditEventDraft.builder(AuditEventType.POLICY_DEACTIVATED)
                .actor(actor)
                .resource("control_policy", policyId, current.key())
                .context("reason", reason)
                .build());
        log.info("Deactivated control policy {}: {}", current.key(), reason);
        return deactivated;
    }
}

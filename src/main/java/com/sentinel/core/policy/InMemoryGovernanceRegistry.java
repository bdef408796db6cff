package com.sentinel.core.policy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reference {@link GovernanceRegistry} holding gates, policies and kill switches
 * in memory, seeded from {@link GovernanceProperties}.
 */
@Component
public class InMemoryGovernanceRegistry implements GovernanceRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryGovernanceRegistry.class);

    private final Map<String, EnforcementGate> gatesByKey = new ConcurrentHashMap<>();
    private final Map<String, ControlPolicy> policiesById = new ConcurrentHashMap<>();
    private final Map<String, KillSwitch> switchesByKey = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper();

    public InMemoryGovernanceRegistry(GovernanceProperties properties) {
        seed(properties);
    }

    @Override
    public Optional<EnforcementGate> gate(String gateKey) {
        return Optional.ofNullable(gateKey == null ? null : gatesByKey.get(gateKey));
    }

    @Override
    public List<KillSwitch> activeKillSwitches(Scope scope) {
        return switchesByKey.values().stream()
                .filter(KillSwitch::active)
                .filter(ks -> ks.appliesTo(scope))
                .sorted(Comparator.comparing(KillSwitch::key))
                .toList();
    }

    @Override
    public List<ControlPolicy> activePolicies(String gateId) {
        EnforcementGate gate = gatesByKey.values().stream()
                .filter(g -> g.id().equals(gateId))
                .findFirst()
                .orElse(null);
        if (gate == null) {
            return List.of();
        }
        return gate.policyIds().stream()
                .map(policiesById::get)
                .filter(Objects::nonNull)
                .filter(ControlPolicy::active)
                .sorted(ControlPolicy.EVALUATION_ORDER)
                .toList();
    }

    @Override
    public List<EnforcementGate> gates() {
        return gatesByKey.values().stream().sorted(Comparator.comparing(EnforcementGate::key)).toList();
    }

    @Override
    public List<KillSwitch> killSwitches() {
        return switchesByKey.values().stream().sorted(Comparator.comparing(KillSwitch::key)).toList();
    }

    @Override
    public Optional<KillSwitch> killSwitch(String key) {
        return Optional.ofNullable(switchesByKey.get(key));
    }

    @Override
    public Optional<ControlPolicy> policy(String policyId) {
        return Optional.ofNullable(policiesById.get(policyId));
    }

    @Override
    public void saveGate(EnforcementGate gate) {
        gatesByKey.put(gate.key(), gate);
    }

    @Override
    public void saveKillSwitch(KillSwitch killSwitch) {
        switchesByKey.put(killSwitch.key(), killSwitch);
    }

    @Override
    public void savePolicy(ControlPolicy policy) {
        policiesById.put(policy.id(), policy);
    }

    // ── Seeding ──────────────────────────────────────────────────────────

    private void seed(GovernanceProperties properties) {
        for (var def : properties.getPolicies()) {
            savePolicy(new ControlPolicy(def.getId(), def.getKey(), def.getName(), def.getAction(),
                    parseDefinition(def.getId(), def.getConditions()),
                    parseDefinition(def.getId(), def.getAutoDenyConditions()),
                    def.getPriority(), def.isActive(), def.getWorkflowId()));
        }
        for (var def : properties.getGates()) {
            String id = def.getId() != null ? def.getId() : def.getKey();
            saveGate(new EnforcementGate(id, def.getKey(), def.getName(), def.getType(), def.getPolicyIds(),
                    def.getMode(), def.isRequireAllPass(), def.isCheckKillSwitches(), def.isCaptureInputs(),
                    def.isCaptureOutputs(), def.isCaptureContext(),
                    new Scope(def.getWorkflowId(), def.getCapabilityId()), def.getTimeout(), def.isActive()));
        }
        for (var def : properties.getKillSwitches()) {
            saveKillSwitch(KillSwitch.define(def.getKey(), def.getName(),
                    new Scope(def.getWorkflowId(), def.getCapabilityId()), def.getMode()));
        }
        log.info("Governance registry seeded: {} gates, {} policies, {} kill switches",
                gatesByKey.size(), policiesById.size(), switchesByKey.size());
    }

    private Map<String, Object> parseDefinition(String policyId, String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Policy " + policyId + " has an unreadable condition: " + json, e);
        }
    }
}

package com.sentinel.core.policy;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Seed governance configuration: gates, control policies and kill switches
 * loaded into the in-memory registry at startup.
 * <p>
 * Policy conditions are written as JSON strings so that value types
 * (booleans, numbers, lists) survive property binding unchanged.
 */
@Component
@ConfigurationProperties(prefix = "sentinel.governance")
public class GovernanceProperties {

    private List<GateDefinition> gates = new ArrayList<>();
    private List<PolicyDefinition> policies = new ArrayList<>();
    private List<KillSwitchDefinition> killSwitches = new ArrayList<>();

    public List<GateDefinition> getGates() {
        return gates;
    }

    public void setGates(List<GateDefinition> gates) {
        this.gates = gates;
    }

    public List<PolicyDefinition> getPolicies() {
        return policies;
    }

    public void setPolicies(List<PolicyDefinition> policies) {
        this.policies = policies;
    }

    public List<KillSwitchDefinition> getKillSwitches() {
        return killSwitches;
    }

    public void setKillSwitches(List<KillSwitchDefinition> killSwitches) {
        this.killSwitches = killSwitches;
    }

    public static class GateDefinition {
        private String id;
        private String key;
        private String name;
        private GateType type;
        private List<String> policyIds = new ArrayList<>();
        private EnforcementMode mode = EnforcementMode.BLOCKING;
        private boolean requireAllPass = true;
        private boolean checkKillSwitches = true;
        private boolean captureInputs;
        private boolean captureOutputs;
        private boolean captureContext = true;
        private String workflowId;
        private String capabilityId;
        private Duration timeout;
        private boolean active = true;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public GateType getType() {
            return type;
        }

        public void setType(GateType type) {
            this.type = type;
        }

        public List<String> getPolicyIds() {
            return policyIds;
        }

        public void setPolicyIds(List<String> policyIds) {
            this.policyIds = policyIds;
        }

        public EnforcementMode getMode() {
            return mode;
        }

        public void setMode(EnforcementMode mode) {
            this.mode = mode;
        }

        public boolean isRequireAllPass() {
            return requireAllPass;
        }

        public void setRequireAllPass(boolean requireAllPass) {
            this.requireAllPass = requireAllPass;
        }

        public boolean isCheckKillSwitches() {
            return checkKillSwitches;
        }

        public void setCheckKillSwitches(boolean checkKillSwitches) {
            this.checkKillSwitches = checkKillSwitches;
        }

        public boolean isCaptureInputs() {
            return captureInputs;
        }

        public void setCaptureInputs(boolean captureInputs) {
            this.captureInputs = captureInputs;
        }

        public boolean isCaptureOutputs() {
            return captureOutputs;
        }

        public void setCaptureOutputs(boolean captureOutputs) {
            this.captureOutputs = captureOutputs;
        }

        public boolean isCaptureContext() {
            return captureContext;
        }

        public void setCaptureContext(boolean captureContext) {
            this.captureContext = captureContext;
        }

        public String getWorkflowId() {
            return workflowId;
        }

        public void setWorkflowId(String workflowId) {
            this.workflowId = workflowId;
        }

        public String getCapabilityId() {
            return capabilityId;
        }

        public void setCapabilityId(String capabilityId) {
            this.capabilityId = capabilityId;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public boolean isActive() {
            return active;
        }

        public void setActive(boolean active) {
            this.active = active;
        }
    }

    public static class PolicyDefinition {
        private String id;
        private String key;
        private String name;
        private PolicyAction action;
        private String conditions;
        private String autoDenyConditions;
        private int priority = 100;
        private boolean active = true;
        private String workflowId;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public PolicyAction getAction() {
            return action;
        }

        public void setAction(PolicyAction action) {
            this.action = action;
        }

        public String getConditions() {
            return conditions;
        }

        public void setConditions(String conditions) {
            this.conditions = conditions;
        }

        public String getAutoDenyConditions() {
            return autoDenyConditions;
        }

        public void setAutoDenyConditions(String autoDenyConditions) {
            this.autoDenyConditions = autoDenyConditions;
        }

        public int getPriority() {
            return priority;
        }

        public void setPriority(int priority) {
            this.priority = priority;
        }

        public boolean isActive() {
            return active;
        }

        public void setActive(boolean active) {
            this.active = active;
        }

        public String getWorkflowId() {
            return workflowId;
        }

        public void setWorkflowId(String workflowId) {
            this.workflowId = workflowId;
        }
    }

    public static class KillSwitchDefinition {
        private String key;
        private String name;
        private KillSwitchMode mode = KillSwitchMode.HARD_STOP;
        private String workflowId;
        private String capabilityId;

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public KillSwitchMode getMode() {
            return mode;
        }

        public void setMode(KillSwitchMode mode) {
            this.mode = mode;
        }

        public String getWorkflowId() {
            return workflowId;
        }

        public void setWorkflowId(String workflowId) {
            this.workflowId = workflowId;
        }

        public String getCapabilityId() {
            return capabilityId;
        }

        public void setCapabilityId(String capabilityId) {
            this.capabilityId = capabilityId;
        }
    }
}

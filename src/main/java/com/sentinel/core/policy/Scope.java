package com.sentinel.core.policy;

/**
 * Where a control applies: globally, or to one workflow and/or capability.
 * A {@code null} component means "any".
 *
 * @param workflowId   workflow identifier (nullable)
 * @param capabilityId capability identifier (nullable)
 */
public record Scope(String workflowId, String capabilityId) {

    public static final Scope GLOBAL = new Scope(null, null);

    public static Scope workflow(String workflowId) {
        return new Scope(workflowId, null);
    }

    public static Scope capability(String capabilityId) {
        return new Scope(null, capabilityId);
    }

    public boolean isGlobal() {
        return workflowId == null && capabilityId == null;
    }

    /**
     * Whether a control scoped here governs actions taking place in {@code target}.
     * Every non-null component of this scope must match the target's.
     */
    public boolean covers(Scope target) {
        if (isGlobal()) {
            return true;
        }
        if (target == null) {
            return false;
        }
        boolean workflowMatches = workflowId == null || workflowId.equals(target.workflowId());
        boolean capabilityMatches = capabilityId == null || capabilityId.equals(target.capabilityId());
        return workflowMatches && capabilityMatches;
    }

    /**
     * Fills components left open here from {@code fallback}.
     */
    public Scope orElse(Scope fallback) {
        if (fallback == null) {
            return this;
        }
        return new Scope(
                workflowId != null ? workflowId : fallback.workflowId(),
                capabilityId != null ? capabilityId : fallback.capabilityId());
    }

    @Override
    public String toString() {
        if (isGlobal()) {
            return "global";
        }
        StringBuilder sb = new StringBuilder();
        if (workflowId != null) {
            sb.append("workflow=").append(workflowId);
        }
        if (capabilityId != null) {
            if (!sb.isEmpty()) {
                sb.append(',');
            }
            sb.append("capability=").append(capabilityId);
        }
        return sb.toString();
    }
}

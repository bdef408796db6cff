package com.sentinel.core.change;

public enum ChangeType {
    WORKFLOW_DEPLOYMENT,
    WORKFLOW_MODIFICATION,
    CAPABILITY_GRANT,
    CAPABILITY_REVOKE,
    CONTROL_POLICY_UPDATE,
    EMERGENCY_ACCESS,
    MODEL_DEPLOYMENT,
    CONFIG_CHANGE
}

package com.sentinel.core.policy;

public enum EnforcementMode {
    BLOCKING,    // BLOCK stops the action
    MONITORING   // policy blocks are reported as warnings only
}

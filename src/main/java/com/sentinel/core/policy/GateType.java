package com.sentinel.core.policy;

public enum GateType {
    PRE_EXECUTION,
    POST_EXECUTION,
    CAPABILITY_REQUEST,
    PRODUCTION_CHANGE,
    DATA_ACCESS,
    MODEL_DEPLOYMENT,
    BREAK_GLASS_ENTRY
}

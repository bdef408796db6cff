package com.sentinel.core.policy;

public enum PolicyAction {
    ALLOW,
    DENY,
    REVIEW
}

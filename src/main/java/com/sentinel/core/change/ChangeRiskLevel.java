package com.sentinel.core.change;

public enum ChangeRiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /** Only low-risk changes skip review and approval. */
    public boolean autoApproves() {
        return this == LOW;
    }

    /** Post-execution verification is mandatory from HIGH upwards. */
    public boolean requiresVerification() {
        return this == HIGH || this == CRITICAL;
    }
}

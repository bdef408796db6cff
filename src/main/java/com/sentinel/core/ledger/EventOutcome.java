package com.sentinel.core.ledger;

public enum EventOutcome {
    SUCCESS,
    FAILURE,
    BLOCKED,
    WARNING,
    ERROR
}

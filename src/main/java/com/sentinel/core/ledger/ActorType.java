package com.sentinel.core.ledger;

public enum ActorType {
    USER,
    AGENT,
    SYSTEM,
    SERVICE
}

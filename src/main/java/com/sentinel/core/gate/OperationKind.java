package com.sentinel.core.gate;

public enum OperationKind {
    READ,
    WRITE
}

package com.sentinel.core.error;

public class NotFoundException extends GovernanceException {

    public NotFoundException(String kind, Object id) {
        super(kind + " not found: " + id);
    }
}

package com.sentinel.core.error;

/**
 * Wraps a storage failure that is neither a conflict nor a missing record.
 */
public class PersistenceException extends GovernanceException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}

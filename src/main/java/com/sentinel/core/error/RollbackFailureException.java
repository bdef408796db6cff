package com.sentinel.core.error;

/**
 * Thrown by a rollback executor when the rollback procedure itself failed.
 */
public class RollbackFailureException extends GovernanceException {

    public RollbackFailureException(String message) {
        super(message);
    }

    public RollbackFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.sentinel.core.error;

/**
 * Root of the governance error taxonomy. All failures raised by the ledger,
 * the gate evaluator and the change request lifecycle extend this type.
 */
public class GovernanceException extends RuntimeException {

    public GovernanceException(String message) {
        super(message);
    }

    public GovernanceException(String message, Throwable cause) {
        super(message, cause);
    }
}

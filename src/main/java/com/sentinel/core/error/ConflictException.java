package com.sentinel.core.error;

/**
 * Thrown when a concurrent writer won a race. Retryable against refreshed state.
 */
public class ConflictException extends GovernanceException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}

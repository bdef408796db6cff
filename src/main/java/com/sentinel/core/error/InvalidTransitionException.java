package com.sentinel.core.error;

/**
 * Thrown when a lifecycle operation is not defined for the current state.
 * The target object is left untouched.
 */
public class InvalidTransitionException extends GovernanceException {

    public InvalidTransitionException(String message) {
        super(message);
    }
}

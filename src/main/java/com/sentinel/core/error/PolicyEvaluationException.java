package com.sentinel.core.error;

/**
 * Thrown when a control policy condition cannot be compiled or evaluated.
 */
public class PolicyEvaluationException extends GovernanceException {

    public PolicyEvaluationException(String message) {
        super(message);
    }

    public PolicyEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.sentinel.core.error;

/**
 * Transient failure fetching kill switches, policies or gates. Retried with backoff.
 */
public class PolicySourceUnavailableException extends GovernanceException {

    public PolicySourceUnavailableException(String message) {
        super(message);
    }

    public PolicySourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.sentinel.core.error;

/**
 * Thrown when the audit chain fails integrity verification.
 * <p>
 * Fatal: dependent processing must halt until an operator has investigated.
 * The ledger never attempts to repair the chain itself.
 */
public class TamperDetectedException extends GovernanceException {

    private final long sequence;

    public TamperDetectedException(long sequence, String reason) {
        super("Audit chain integrity violation at sequence " + sequence + ": " + reason);
        this.sequence = sequence;
    }

    public long sequence() {
        return sequence;
    }
}

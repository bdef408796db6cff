package com.sentinel.core.ledger;

/**
 * Outcome of re-verifying a range of the audit chain.
 *
 * @param valid         true when every event in range recomputed and linked correctly
 * @param firstMismatch first sequence that failed verification (null when valid)
 * @param reason        why verification failed (null when valid)
 * @param checked       number of events inspected
 */
public record ChainVerification(boolean valid, Long firstMismatch, String reason, long checked) {

    public static ChainVerification ok(long checked) {
        return new ChainVerification(true, null, null, checked);
    }

    public static ChainVerification broken(long sequence, String reason, long checked) {
        return new ChainVerification(false, sequence, reason, checked);
    }
}

package com.sentinel.core.ledger;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence port for the audit ledger.
 * <p>
 * Implementations must reject a second event with an already-used sequence
 * by throwing {@link com.sentinel.core.error.ConflictException}.
 */
public interface LedgerStore {

    void appendEvent(AuditEvent event);

    Optional<AuditEvent> readTip();

    /**
     * Events with {@code from <= sequence <= to}, ordered by sequence.
     */
    List<AuditEvent> readRange(long from, long to);

    Optional<AuditEvent> findById(UUID id);

    /**
     * The most recent events, newest first.
     */
    List<AuditEvent> readLatest(int limit);
}

package com.sentinel.core.ledger;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable, hash-chained entry of the audit ledger.
 * <p>
 * {@code eventHash = SHA-256(canonical(fields) ‖ previousHash)}; the first event
 * of the chain carries a {@code null} previous hash.
 *
 * @param id           event identifier
 * @param sequence     gap-free position in the chain, starting at 1
 * @param eventType    what happened
 * @param action       short action label, e.g. {@code gate.evaluate}
 * @param actor        who did it
 * @param resource     what it concerned (nullable)
 * @param outcome      result of the action
 * @param context      structured details, JSON-compatible values only
 * @param previousHash hash of the event at {@code sequence - 1}
 * @param eventHash    hash of this event
 * @param createdAt    creation time, millisecond precision
 */
public record AuditEvent(
    UUID id,
    long sequence,
    AuditEventType eventType,
    String action,
    Actor actor,
    ResourceRef resource,
    EventOutcome outcome,
    Map<String, Object> context,
    String previousHash,
    String eventHash,
    Instant createdAt
) {

    public AuditEvent {
        context = context == null ? Map.of() : context;
    }
}

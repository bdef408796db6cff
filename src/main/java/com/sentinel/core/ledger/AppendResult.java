package com.sentinel.core.ledger;

import java.util.UUID;

/**
 * Position and hash assigned to a freshly appended event.
 */
public record AppendResult(UUID eventId, long sequence, String hash) {}

package com.sentinel.core.change;

import java.time.Instant;

/**
 * @param executedBy actor that triggered the rollback
 * @param executedAt when it ran
 * @param reason     why the change was rolled back
 * @param executed   whether the rollback procedure was run at all
 * @param successful whether the procedure reported success
 * @param detail     executor report or failure message
 */
public record RollbackRecord(
    String executedBy,
    Instant executedAt,
    String reason,
    boolean executed,
    boolean successful,
    String detail
) {}

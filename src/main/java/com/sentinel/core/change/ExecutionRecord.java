package com.sentinel.core.change;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Execution sub-record of a change request.
 *
 * @param startedBy   actor that began execution
 * @param startedAt   when the production-change gate let execution start
 * @param completedAt when the executor reported back (null while running)
 * @param successful  executor result (null while running)
 * @param notes       free-form notes from the executor
 * @param output      structured executor output
 */
public record ExecutionRecord(
    String startedBy,
    Instant startedAt,
    Instant completedAt,
    Boolean successful,
    String notes,
    Map<String, Object> output
) {

    public ExecutionRecord {
        output = output == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(output));
    }

    public static ExecutionRecord started(String actorId, Instant at) {
        return new ExecutionRecord(actorId, at, null, null, null, Map.of());
    }

    public ExecutionRecord complete(ExecutionResult result, Instant at) {
        return new ExecutionRecord(startedBy, startedAt, at, result.successful(), result.notes(), result.output());
    }
}

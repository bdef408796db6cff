package com.sentinel.core.change;

import java.util.Map;

/**
 * What the (external) executor reports after performing a change.
 *
 * @param successful          whether the change itself was applied
 * @param notes               free-form notes
 * @param output              structured output to keep on the request
 * @param verificationResults criterion results if the executor already verified; empty otherwise
 */
public record ExecutionResult(
    boolean successful,
    String notes,
    Map<String, Object> output,
    Map<String, Boolean> verificationResults
) {

    public ExecutionResult {
        output = output == null ? Map.of() : output;
        verificationResults = verificationResults == null ? Map.of() : verificationResults;
    }

    public static ExecutionResult success(String notes) {
        return new ExecutionResult(true, notes, Map.of(), Map.of());
    }

    public static ExecutionResult failure(String notes) {
        return new ExecutionResult(false, notes, Map.of(), Map.of());
    }

    public ExecutionResult withVerification(Map<String, Boolean> results) {
        return new ExecutionResult(successful, notes, output, results);
    }
}

package com.sentinel.core.change;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @param verifiedBy     actor that reported the results
 * @param verifiedAt     when they were reported
 * @param passed         true only if every required criterion passed
 * @param results        criterion name to pass/fail
 * @param failedCriteria criteria that failed or were not reported
 */
public record VerificationRecord(
    String verifiedBy,
    Instant verifiedAt,
    boolean passed,
    Map<String, Boolean> results,
    List<String> failedCriteria
) {

    public VerificationRecord {
        results = results == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(results));
        failedCriteria = failedCriteria == null ? List.of() : List.copyOf(failedCriteria);
    }
}

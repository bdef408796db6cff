package com.sentinel.core.change;

import com.sentinel.core.ledger.Actor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Caller-supplied fields of a new change request, or the replacement content of a draft.
 *
 * @param changeKey            human-readable key, unique per request
 * @param verificationRequired force post-execution verification; HIGH and CRITICAL always verify
 * @param verificationCriteria criteria that must all pass during verification
 * @param changeDetails        change parameters, e.g. workflow config or model artifact
 * @param impactAssessment     affected systems, downtime, rollback time, data and compliance impact
 * @param testingEvidence      pre-production results, e.g. {@code validationPassed}, {@code testCoverage}
 * @param metadata             compliance tags, stakeholders, emergency contact
 */
public record ChangeRequestDraft(
    String changeKey,
    ChangeType changeType,
    ChangeRiskLevel riskLevel,
    String title,
    String description,
    String rationale,
    String rollbackProcedure,
    String workflowId,
    String capabilityId,
    Actor requestedBy,
    boolean verificationRequired,
    List<String> verificationCriteria,
    Map<String, Object> changeDetails,
    Map<String, Object> impactAssessment,
    Map<String, Object> testingEvidence,
    Map<String, Object> metadata
) {

    public ChangeRequestDraft {
        verificationCriteria = verificationCriteria == null ? List.of() : List.copyOf(verificationCriteria);
        changeDetails = content(changeDetails);
        impactAssessment = content(impactAssessment);
        testingEvidence = content(testingEvidence);
        metadata = content(metadata);
    }

    /**
     * Draft without structured change content.
     */
    public ChangeRequestDraft(String changeKey, ChangeType changeType, ChangeRiskLevel riskLevel, String title,
                              String description, String rationale, String rollbackProcedure, String workflowId,
                              String capabilityId, Actor requestedBy, boolean verificationRequired,
                              List<String> verificationCriteria) {
        this(changeKey, changeType, riskLevel, title, description, rationale, rollbackProcedure, workflowId,
                capabilityId, requestedBy, verificationRequired, verificationCriteria, null, null, null, null);
    }

    // JSON content may hold nulls, so Map.copyOf is not an option
    private static Map<String, Object> content(Map<String, Object> values) {
        return values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}

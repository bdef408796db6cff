package com.sentinel.core.change;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.sentinel.core.ledger.Actor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A governed change moving through review, approval, scheduled execution,
 * verification and rollback.
 * <p>
 * Instances are mutable working copies owned by {@link ChangeRequestService}; the store
 * hands out copies and accepts a write only if {@link #getVersion()} still matches.
 */
public class ChangeRequest {

    private UUID id;
    private String changeKey;
    private ChangeType changeType;
    private ChangeRiskLevel riskLevel;
    private String title;
    private String description;
    private String rationale;
    private String rollbackProcedure;
    private String workflowId;
    private String capabilityId;

    private Actor requestedBy;
    private Instant createdAt;
    private Instant submittedAt;

    private String reviewedBy;
    private Instant reviewedAt;
    private String reviewNotes;

    private String approvedBy;
    private Instant approvedAt;
    private String approvalNotes;

    private String rejectedBy;
    private Instant rejectedAt;
    private String rejectionReason;

    private String cancelledBy;
    private Instant cancelledAt;
    private String cancellationReason;

    private Instant scheduledStart;
    private Instant scheduledEnd;

    private boolean verificationRequired;
    private List<String> verificationCriteria = new ArrayList<>();

    private Map<String, Object> changeDetails = new LinkedHashMap<>();
    private Map<String, Object> impactAssessment = new LinkedHashMap<>();
    private Map<String, Object> testingEvidence = new LinkedHashMap<>();
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private ExecutionRecord execution;
    private VerificationRecord verification;
    private RollbackRecord rollback;

    private ChangeStatus status = ChangeStatus.DRAFT;
    private long version;
    private Instant updatedAt;
    private List<UUID> ledgerEventIds = new ArrayList<>();

    public ChangeRequest() {
    }

    static ChangeRequest fromDraft(ChangeRequestDraft draft, Instant now) {
        ChangeRequest request = new ChangeRequest();
        request.id = UUID.randomUUID();
        request.changeKey = draft.changeKey();
        request.requestedBy = draft.requestedBy();
        request.applyContent(draft);
        request.createdAt = now;
        request.updatedAt = now;
        return request;
    }

    /**
     * Replaces every editable field with the draft's. Key and requester are fixed at creation.
     */
    void applyContent(ChangeRequestDraft draft) {
        changeType = draft.changeType();
        riskLevel = draft.riskLevel();
        title = draft.title();
        description = draft.description();
        rationale = draft.rationale();
        rollbackProcedure = draft.rollbackProcedure();
        workflowId = draft.workflowId();
        capabilityId = draft.capabilityId();
        verificationRequired = draft.verificationRequired();
        verificationCriteria = new ArrayList<>(draft.verificationCriteria());
        changeDetails = new LinkedHashMap<>(draft.changeDetails());
        impactAssessment = new LinkedHashMap<>(draft.impactAssessment());
        testingEvidence = new LinkedHashMap<>(draft.testingEvidence());
        metadata = new LinkedHashMap<>(draft.metadata());
    }

    /**
     * Independent copy; sub-records are immutable and shared.
     */
    public ChangeRequest copy() {
        ChangeRequest c = new ChangeRequest();
        c.id = id;
        c.changeKey = changeKey;
        c.changeType = changeType;
        c.riskLevel = riskLevel;
        c.title = title;
        c.description = description;
        c.rationale = rationale;
        c.rollbackProcedure = rollbackProcedure;
        c.workflowId = workflowId;
        c.capabilityId = capabilityId;
        c.requestedBy = requestedBy;
        c.createdAt = createdAt;
        c.submittedAt = submittedAt;
        c.reviewedBy = reviewedBy;
        c.reviewedAt = reviewedAt;
        c.reviewNotes = reviewNotes;
        c.approvedBy = approvedBy;
        c.approvedAt = approvedAt;
        c.approvalNotes = approvalNotes;
        c.rejectedBy = rejectedBy;
        c.rejectedAt = rejectedAt;
        c.rejectionReason = rejectionReason;
        c.cancelledBy = cancelledBy;
        c.cancelledAt = cancelledAt;
        c.cancellationReason = cancellationReason;
        c.scheduledStart = scheduledStart;
        c.scheduledEnd = scheduledEnd;
        c.verificationRequired = verificationRequired;
        c.verificationCriteria = new ArrayList<>(verificationCriteria);
        c.changeDetails = new LinkedHashMap<>(changeDetails);
        c.impactAssessment = new LinkedHashMap<>(impactAssessment);
        c.testingEvidence = new LinkedHashMap<>(testingEvidence);
        c.metadata = new LinkedHashMap<>(metadata);
        c.execution = execution;
        c.verification = verification;
        c.rollback = rollback;
        c.status = status;
        c.version = version;
        c.updatedAt = updatedAt;
        c.ledgerEventIds = new ArrayList<>(ledgerEventIds);
        return c;
    }

    /**
     * Whether completion must pass through verification: requested explicitly,
     * criteria listed, or a HIGH/CRITICAL risk level.
     */
    @JsonIgnore
    public boolean needsVerification() {
        return verificationRequired
                || !verificationCriteria.isEmpty()
                || (riskLevel != null && riskLevel.requiresVerification());
    }

    @JsonIgnore
    public boolean isRollbackExecuted() {
        return rollback != null && rollback.executed();
    }

    @JsonIgnore
    public boolean isRollbackSuccessful() {
        return rollback != null && rollback.successful();
    }

    @JsonIgnore
    public boolean isWithinWindow(Instant at) {
        return scheduledStart != null && scheduledEnd != null
                && !at.isBefore(scheduledStart) && !at.isAfter(scheduledEnd);
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getChangeKey() { return changeKey; }
    public void setChangeKey(String changeKey) { this.changeKey = changeKey; }

    public ChangeType getChangeType() { return changeType; }
    public void setChangeType(ChangeType changeType) { this.changeType = changeType; }

    public ChangeRiskLevel getRiskLevel() { return riskLevel; }
    public void setRiskLevel(ChangeRiskLevel riskLevel) { this.riskLevel = riskLevel; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getRationale() { return rationale; }
    public void setRationale(String rationale) { this.rationale = rationale; }

    public String getRollbackProcedure() { return rollbackProcedure; }
    public void setRollbackProcedure(String rollbackProcedure) { this.rollbackProcedure = rollbackProcedure; }

    public String getWorkflowId() { return workflowId; }
    public void setWorkflowId(String workflowId) { this.workflowId = workflowId; }

    public String getCapabilityId() { return capabilityId; }
    public void setCapabilityId(String capabilityId) { this.capabilityId = capabilityId; }

    public Actor getRequestedBy() { return requestedBy; }
    public void setRequestedBy(Actor requestedBy) { this.requestedBy = requestedBy; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getSubmittedAt() { return submittedAt; }
    public void setSubmittedAt(Instant submittedAt) { this.submittedAt = submittedAt; }

    public String getReviewedBy() { return reviewedBy; }
    public void setReviewedBy(String reviewedBy) { this.reviewedBy = reviewedBy; }

    public Instant getReviewedAt() { return reviewedAt; }
    public void setReviewedAt(Instant reviewedAt) { this.reviewedAt = reviewedAt; }

    public String getReviewNotes() { return reviewNotes; }
    public void setReviewNotes(String reviewNotes) { this.reviewNotes = reviewNotes; }

    public String getApprovedBy() { return approvedBy; }
    public void setApprovedBy(String approvedBy) { this.approvedBy = approvedBy; }

    public Instant getApprovedAt() { return approvedAt; }
    public void setApprovedAt(Instant approvedAt) { this.approvedAt = approvedAt; }

    public String getApprovalNotes() { return approvalNotes; }
    public void setApprovalNotes(String approvalNotes) { this.approvalNotes = approvalNotes; }

    public String getRejectedBy() { return rejectedBy; }
    public void setRejectedBy(String rejectedBy) { this.rejectedBy = rejectedBy; }

    public Instant getRejectedAt() { return rejectedAt; }
    public void setRejectedAt(Instant rejectedAt) { this.rejectedAt = rejectedAt; }

    public String getRejectionReason() { return rejectionReason; }
    public void setRejectionReason(String rejectionReason) { this.rejectionReason = rejectionReason; }

    public String getCancelledBy() { return cancelledBy; }
    public void setCancelledBy(String cancelledBy) { this.cancelledBy = cancelledBy; }

    public Instant getCancelledAt() { return cancelledAt; }
    public void setCancelledAt(Instant cancelledAt) { this.cancelledAt = cancelledAt; }

    public String getCancellationReason() { return cancellationReason; }
    public void setCancellationReason(String cancellationReason) { this.cancellationReason = cancellationReason; }

    public Instant getScheduledStart() { return scheduledStart; }
    public void setScheduledStart(Instant scheduledStart) { this.scheduledStart = scheduledStart; }

    public Instant getScheduledEnd() { return scheduledEnd; }
    public void setScheduledEnd(Instant scheduledEnd) { this.scheduledEnd = scheduledEnd; }

    public boolean isVerificationRequired() { return verificationRequired; }
    public void setVerificationRequired(boolean verificationRequired) { this.verificationRequired = verificationRequired; }

    public List<String> getVerificationCriteria() { return verificationCriteria; }
    public void setVerificationCriteria(List<String> verificationCriteria) {
        this.verificationCriteria = verificationCriteria == null ? new ArrayList<>() : new ArrayList<>(verificationCriteria);
    }

    public Map<String, Object> getChangeDetails() { return changeDetails; }
    public void setChangeDetails(Map<String, Object> changeDetails) { this.changeDetails = mutableContent(changeDetails); }

    public Map<String, Object> getImpactAssessment() { return impactAssessment; }
    public void setImpactAssessment(Map<String, Object> impactAssessment) { this.impactAssessment = mutableContent(impactAssessment); }

    public Map<String, Object> getTestingEvidence() { return testingEvidence; }
    public void setTestingEvidence(Map<String, Object> testingEvidence) { this.testingEvidence = mutableContent(testingEvidence); }

    public Map<String, Object> getMetadata() { return metadata; }
    public void setMetadata(Map<String, Object> metadata) { this.metadata = mutableContent(metadata); }

    public ExecutionRecord getExecution() { return execution; }
    public void setExecution(ExecutionRecord execution) { this.execution = execution; }

    public VerificationRecord getVerification() { return verification; }
    public void setVerification(VerificationRecord verification) { this.verification = verification; }

    public RollbackRecord getRollback() { return rollback; }
    public void setRollback(RollbackRecord rollback) { this.rollback = rollback; }

    public ChangeStatus getStatus() { return status; }
    public void setStatus(ChangeStatus status) { this.status = status; }

    public long getVersion() { return version; }
    public void setVersion(long version) { this.version = version; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public List<UUID> getLedgerEventIds() { return ledgerEventIds; }
    public void setLedgerEventIds(List<UUID> ledgerEventIds) {
        this.ledgerEventIds = ledgerEventIds == null ? new ArrayList<>() : new ArrayList<>(ledgerEventIds);
    }

    private static Map<String, Object> mutableContent(Map<String, Object> values) {
        return values == null ? new LinkedHashMap<>() : new LinkedHashMap<>(values);
    }
}

package com.sentinel.core.breakglass;

import com.sentinel.core.ledger.Actor;
import com.sentinel.core.policy.Scope;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * A time-bounded emergency override of the control policy layer.
 * Kill switches always remain in force while a grant is active.
 */
public class BreakGlassGrant {

    private UUID id;
    private String grantKey;
    private String workflowId;
    private BreakGlassReason reason;
    private String justification;
    private String incidentId;
    private BreakGlassStatus status = BreakGlassStatus.PENDING;
    private Duration duration;

    private Actor requestedBy;
    private Instant requestedAt;

    private String approvedBy;
    private Instant approvedAt;
    private String approvalNotes;
    private UUID approvalGateExecutionId;
    private Instant validFrom;
    private Instant validUntil;

    private String deniedBy;
    private Instant deniedAt;
    private String denialReason;

    private String revokedBy;
    private Instant revokedAt;
    private String revocationReason;

    private boolean postIncidentReviewCompleted;
    private String postIncidentReviewedBy;
    private Instant postIncidentReviewedAt;
    private String postIncidentNotes;

    private long version;

    public BreakGlassGrant() {
    }

    public BreakGlassGrant copy() {
        BreakGlassGrant c = new BreakGlassGrant();
        c.id = id;
        c.grantKey = grantKey;
        c.workflowId = workflowId;
        c.reason = reason;
        c.justification = justification;
        c.incidentId = incidentId;
        c.status = status;
        c.duration = duration;
        c.requestedBy = requestedBy;
        c.requestedAt = requestedAt;
        c.approvedBy = approvedBy;
        c.approvedAt = approvedAt;
        c.approvalNotes = approvalNotes;
        c.approvalGateExecutionId = approvalGateExecutionId;
        c.validFrom = validFrom;
        c.validUntil = validUntil;
        c.deniedBy = deniedBy;
        c.deniedAt = deniedAt;
        c.denialReason = denialReason;
        c.revokedBy = revokedBy;
        c.revokedAt = revokedAt;
        c.revocationReason = revocationReason;
        c.postIncidentReviewCompleted = postIncidentReviewCompleted;
        c.postIncidentReviewedBy = postIncidentReviewedBy;
        c.postIncidentReviewedAt = postIncidentReviewedAt;
        c.postIncidentNotes = postIncidentNotes;
        c.version = version;
        return c;
    }

    public Scope scope() {
        return workflowId == null ? Scope.GLOBAL : Scope.workflow(workflowId);
    }

    /**
     * Approved and {@code now} within {@code [validFrom, validUntil]}.
     */
    public boolean isActive(Instant now) {
        return status == BreakGlassStatus.APPROVED
                && validFrom != null && validUntil != null
                && !now.isBefore(validFrom) && !now.isAfter(validUntil);
    }

    public boolean isElapsed(Instant now) {
        return validUntil != null && now.isAfter(validUntil);
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getGrantKey() { return grantKey; }
    public void setGrantKey(String grantKey) { this.grantKey = grantKey; }

    public String getWorkflowId() { return workflowId; }
    public void setWorkflowId(String workflowId) { this.workflowId = workflowId; }

    public BreakGlassReason getReason() { return reason; }
    public void setReason(BreakGlassReason reason) { this.reason = reason; }

    public String getJustification() { return justification; }
    public void setJustification(String justification) { this.justification = justification; }

    public String getIncidentId() { return incidentId; }
    public void setIncidentId(String incidentId) { this.incidentId = incidentId; }

    public BreakGlassStatus getStatus() { return status; }
    public void setStatus(BreakGlassStatus status) { this.status = status; }

    public Duration getDuration() { return duration; }
    public void setDuration(Duration duration) { this.duration = duration; }

    public Actor getRequestedBy() { return requestedBy; }
    public void setRequestedBy(Actor requestedBy) { this.requestedBy = requestedBy; }

    public Instant getRequestedAt() { return requestedAt; }
    public void setRequestedAt(Instant requestedAt) { this.requestedAt = requestedAt; }

    public String getApprovedBy() { return approvedBy; }
    public void setApprovedBy(String approvedBy) { this.approvedBy = approvedBy; }

    public Instant getApprovedAt() { return approvedAt; }
    public void setApprovedAt(Instant approvedAt) { this.approvedAt = approvedAt; }

    public String getApprovalNotes() { return approvalNotes; }
    public void setApprovalNotes(String approvalNotes) { this.approvalNotes = approvalNotes; }

    public UUID getApprovalGateExecutionId() { return approvalGateExecutionId; }
    public void setApprovalGateExecutionId(UUID approvalGateExecutionId) { this.approvalGateExecutionId = approvalGateExecutionId; }

    public Instant getValidFrom() { return validFrom; }
    public void setValidFrom(Instant validFrom) { this.validFrom = validFrom; }

    public Instant getValidUntil() { return validUntil; }
    public void setValidUntil(Instant validUntil) { this.validUntil = validUntil; }

    public String getDeniedBy() { return deniedBy; }
    public void setDeniedBy(String deniedBy) { this.deniedBy = deniedBy; }

    public Instant getDeniedAt() { return deniedAt; }
    public void setDeniedAt(Instant deniedAt) { this.deniedAt = deniedAt; }

    public String getDenialReason() { return denialReason; }
    public void setDenialReason(String denialReason) { this.denialReason = denialReason; }

    public String getRevokedBy() { return revokedBy; }
    public void setRevokedBy(String revokedBy) { this.revokedBy = revokedBy; }

    public Instant getRevokedAt() { return revokedAt; }
    public void setRevokedAt(Instant revokedAt) { this.revokedAt = revokedAt; }

    public String getRevocationReason() { return revocationReason; }
    public void setRevocationReason(String revocationReason) { this.revocationReason = revocationReason; }

    public boolean isPostIncidentReviewCompleted() { return postIncidentReviewCompleted; }
    public void setPostIncidentReviewCompleted(boolean postIncidentReviewCompleted) { this.postIncidentReviewCompleted = postIncidentReviewCompleted; }

    public String getPostIncidentReviewedBy() { return postIncidentReviewedBy; }
    public void setPostIncidentReviewedBy(String postIncidentReviewedBy) { this.postIncidentReviewedBy = postIncidentReviewedBy; }

    public Instant getPostIncidentReviewedAt() { return postIncidentReviewedAt; }
    public void setPostIncidentReviewedAt(Instant postIncidentReviewedAt) { this.postIncidentReviewedAt = postIncidentReviewedAt; }

    public String getPostIncidentNotes() { return postIncidentNotes; }
    public void setPostIncidentNotes(String postIncidentNotes) { this.postIncidentNotes = postIncidentNotes; }

    public long getVersion() { return version; }
    public void setVersion(long version) { this.version = version; }
}

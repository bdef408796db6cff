package com.sentinel.dispatch.cli;

import com.sentinel.core.change.ChangeRequest;
import com.sentinel.core.change.ChangeRequestService;
import com.sentinel.core.ledger.AuditEvent;
import com.sentinel.core.ledger.Ledger;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Optional;
import java.util.UUID;

/**
 * CLI command: sentinel change &lt;id&gt;
 * <p>
 * Shows a change request with its schedule, execution, verification and rollback
 * records, followed by every ledger event linked to it.
 */
@Command(name = "change", mixinStandardHelpOptions = true, description = "Inspect a change request")
@Component
public class ChangeCommand implements Runnable {

    @Parameters(index = "0", description = "Change request id")
    private UUID changeId;

    private final ChangeRequestService changeService;
    private final Ledger ledger;

    public ChangeCommand(ChangeRequestService changeService, Ledger ledger) {
        this.changeService = changeService;
        this.ledger = ledger;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        ChangeRequest request = changeService.get(changeId);
        ConsoleOutput.info("Change " + request.getChangeKey() + " (" + request.getId() + ")");
        ConsoleOutput.field("Title", request.getTitle());
        ConsoleOutput.field("Type", request.getChangeType());
        ConsoleOutput.field("Risk", request.getRiskLevel());
        ConsoleOutput.field("Status", request.getStatus());
        ConsoleOutput.field("Requested by", request.getRequestedBy());
        ConsoleOutput.field("Reviewed by", request.getReviewedBy());
        ConsoleOutput.field("Approved by", request.getApprovedBy());
        if (request.getScheduledStart() != null) {
            ConsoleOutput.field("Window", request.getScheduledStart() + " .. " + request.getScheduledEnd());
        }
        if (request.getRejectionReason() != null) {
            ConsoleOutput.field("Rejected", request.getRejectionReason());
        }
        if (request.getExecution() != null) {
            var execution = request.getExecution();
            ConsoleOutput.field("Execution", execution.successful() == null ? "running since " + execution.startedAt()
                    : (execution.successful() ? "succeeded" : "failed") + " at " + execution.completedAt());
        }
        if (request.getVerification() != null) {
            var verification = request.getVerification();
            ConsoleOutput.field("Verification", verification.passed() ? "passed"
                    : "failed " + verification.failedCriteria());
        }
        if (request.getRollback() != null) {
            var rollback = request.getRollback();
            ConsoleOutput.field("Rollback", (rollback.successful() ? "succeeded" : "FAILED") + ": " + rollback.reason());
        }

        System.out.println();
        ConsoleOutput.info("Ledger events (" + request.getLedgerEventIds().size() + "):");
        for (UUID eventId : request.getLedgerEventIds()) {
            Optional<AuditEvent> event = ledger.findEvent(eventId);
            if (event.isPresent()) {
                AuditEvent e = event.get();
                System.out.printf("  %-8d %-34s %-9s %s%n", e.sequence(), e.eventType().name(),
                        e.outcome().name(), e.createdAt());
            } else {
                ConsoleOutput.error("Event " + eventId + " missing from ledger");
            }
        }
    }
}

package com.sentinel.dispatch.cli;

import com.sentinel.core.ledger.AuditEvent;
import com.sentinel.core.ledger.Ledger;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: sentinel ledger
 * <p>
 * Lists the most recent audit events, oldest first:
 * Sequence | Type | Outcome | Actor | Hash.
 */
@Command(name = "ledger", mixinStandardHelpOptions = true, description = "List recent audit events")
@Component
public class LedgerCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of events", defaultValue = "20")
    private int limit;

    private final Ledger ledger;

    public LedgerCommand(Ledger ledger) {
        this.ledger = ledger;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<AuditEvent> latest = ledger.latest(limit);
        if (latest.isEmpty()) {
            ConsoleOutput.info("No audit events recorded.");
            return;
        }

        ConsoleOutput.info("Audit events (latest " + latest.size() + "):");
        System.out.println();
        System.out.printf("  %-8s %-34s %-9s %-28s %s%n", "SEQ", "TYPE", "OUTCOME", "ACTOR", "HASH");
        System.out.println("  " + "-".repeat(92));

        for (int i = latest.size() - 1; i >= 0; i--) {
            AuditEvent event = latest.get(i);
            System.out.printf("  %-8d %-34s %-9s %-28s %s%n",
                    event.sequence(),
                    event.eventType().name(),
                    event.outcome().name(),
                    ConsoleOutput.truncate(event.actor().toString(), 28),
                    ConsoleOutput.abbreviate(event.eventHash()));
        }
    }
}

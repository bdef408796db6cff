package com.sentinel.dispatch.cli;

import com.sentinel.core.ledger.AuditEvent;
import com.sentinel.core.ledger.ChainVerification;
import com.sentinel.core.ledger.Ledger;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: sentinel verify
 * <p>
 * Recomputes the hash chain over a range of the audit ledger and reports
 * the first sequence that fails. Exits non-zero when the chain is broken.
 */
@Command(name = "verify", mixinStandardHelpOptions = true, description = "Verify audit ledger integrity")
@Component
public class VerifyCommand implements Callable<Integer> {

    @Option(names = "--from", description = "First sequence to verify", defaultValue = "1")
    private long from;

    @Option(names = "--to", description = "Last sequence to verify (default: chain tip)")
    private Long to;

    private final Ledger ledger;

    public VerifyCommand(Ledger ledger) {
        this.ledger = ledger;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Optional<AuditEvent> tip = ledger.tip();
        if (tip.isEmpty()) {
            ConsoleOutput.info("Ledger is empty; nothing to verify.");
            return 0;
        }

        long last = to != null ? to : tip.get().sequence();
        ConsoleOutput.info("Verifying sequences " + from + ".." + last);
        ChainVerification result = ledger.verifyChain(from, last);

        if (result.valid()) {
            ConsoleOutput.success("Chain intact (" + result.checked() + " events checked)");
            return 0;
        }
        ConsoleOutput.error("Chain broken at sequence " + result.firstMismatch() + ": " + result.reason());
        return GovernanceExceptionHandler.EXIT_TAMPERED;
    }
}

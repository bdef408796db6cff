package com.sentinel.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Sentinel.
 * Routes to subcommands: verify, ledger, evaluate, change, switches, health.
 */
@Command(
        name = "sentinel",
        mixinStandardHelpOptions = true,
        version = "Sentinel 0.1.0",
        description = "Governance core: audit ledger, enforcement gates and change control",
        subcommands = {
                VerifyCommand.class,
                LedgerCommand.class,
                EvaluateCommand.class,
                ChangeCommand.class,
                SwitchesCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SentinelCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}

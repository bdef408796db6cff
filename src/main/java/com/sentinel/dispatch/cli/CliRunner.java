package com.sentinel.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final SentinelCommand sentinelCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(SentinelCommand sentinelCommand, IFactory factory) {
        this.sentinelCommand = sentinelCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        exitCode = commandLine(sentinelCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static CommandLine commandLine(SentinelCommand command, IFactory factory) {
        return new CommandLine(command, factory)
                .setExecutionExceptionHandler(new GovernanceExceptionHandler());
    }
}

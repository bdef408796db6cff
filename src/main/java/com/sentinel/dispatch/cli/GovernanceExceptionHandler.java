package com.sentinel.dispatch.cli;

import com.sentinel.core.error.ConflictException;
import com.sentinel.core.error.GovernanceException;
import com.sentinel.core.error.InvalidTransitionException;
import com.sentinel.core.error.NotFoundException;
import com.sentinel.core.error.TamperDetectedException;
import com.sentinel.core.error.ValidationException;
import com.sentinel.core.error.WindowExpiredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.IExecutionExceptionHandler;
import picocli.CommandLine.ParseResult;

/**
 * Prints governance failures as a single error line and maps them to exit codes.
 * Anything that is not a {@link GovernanceException} is logged with its stack trace.
 */
public class GovernanceExceptionHandler implements IExecutionExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GovernanceExceptionHandler.class);

    static final int EXIT_FAILURE = 1;
    static final int EXIT_VALIDATION = 2;
    static final int EXIT_NOT_FOUND = 3;
    static final int EXIT_INVALID_STATE = 4;
    static final int EXIT_CONFLICT = 5;
    static final int EXIT_TAMPERED = 10;

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, ParseResult parseResult) {
        if (ex instanceof GovernanceException) {
            ConsoleOutput.error(ex.getMessage());
        } else {
            log.error("Command '{}' failed", commandLine.getCommandName(), ex);
            ConsoleOutput.error("Unexpected failure: " + ex.getMessage());
        }
        return exitCodeFor(ex);
    }

    static int exitCodeFor(Exception ex) {
        if (ex instanceof ValidationException) return EXIT_VALIDATION;
        if (ex instanceof NotFoundException) return EXIT_NOT_FOUND;
        if (ex instanceof InvalidTransitionException || ex instanceof WindowExpiredException) return EXIT_INVALID_STATE;
        if (ex instanceof ConflictException) return EXIT_CONFLICT;
        if (ex instanceof TamperDetectedException) return EXIT_TAMPERED;
        return EXIT_FAILURE;
    }
}

package com.sentinel.dispatch.cli;

import com.sentinel.core.gate.GateDecision;
import com.sentinel.core.gate.GateOutcome;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Sentinel CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SENTINEL v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SENTINEL]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void field(String label, Object value) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold " + label + ":|@ " + (value == null ? "-" : value)));
    }

    public static void decision(GateDecision decision) {
        String color = switch (decision.outcome()) {
            case ALLOW -> "fg(green)";
            case WARNING, DEGRADE -> "fg(yellow)";
            case BLOCK, HARD_STOP -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + ",bold [" + decision.outcome() + "]|@ " + decision.reason()));
        if (decision.outcome() == GateOutcome.WARNING && decision.permitsExecution()) {
            info("Gate is in monitoring mode; execution permitted");
        }
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }

    static String abbreviate(String hash) {
        return hash == null ? "-" : hash.substring(0, Math.min(12, hash.length()));
    }
}

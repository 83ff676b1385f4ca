package com.taskweave.dispatch.cli;

import com.taskweave.core.context.DegradationRecord;
import com.taskweave.core.context.UnitDescriptor;
import com.taskweave.core.health.HealthStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Taskweave CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TASKWEAVE v" + TaskweaveCommand.version() + "|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TASKWEAVE]|@ " + message));
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

    public static void healthCheck(HealthStatus status) {
        String label = status.check() + ": " + status.detail();
        switch (status.status()) {
            case HEALTHY -> success(label);
            case WARNING -> warn(label);
            case CRITICAL -> error(label);
        }
    }

    public static void unitState(UnitDescriptor unit) {
        String color = switch (unit.state()) {
            case COMPLETED -> "green";
            case FAILED -> "red";
            case RUNNING -> "cyan";
            case INITIALIZED -> "white";
        };
        String retries = unit.retryCount() > 0 ? " (" + unit.retryCount() + " retries)" : "";
        String error = unit.error() != null ? " - " + unit.error() : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(" + color + ") " + unit.state() + "|@ " + unit.name() + retries + error));
    }

    public static void degradation(DegradationRecord record) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(magenta) [DEGRADED]|@ " + record.unit() + " -> " + record.degradedTo()
                        + " (" + record.failureKind() + ") at " + record.timestamp()));
    }
}

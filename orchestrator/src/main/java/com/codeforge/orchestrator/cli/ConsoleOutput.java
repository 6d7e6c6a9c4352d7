package com.codeforge.orchestrator.cli;

import com.codeforge.orchestrator.model.TaskStatus;
import picocli.CommandLine;

import java.io.PrintStream;

/**
 * ANSI-coloured terminal output for the codeforge CLI.
 */
public final class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    private static PrintStream out() {
        return System.out;
    }

    public static void printBanner() {
        out().println(CommandLine.Help.Ansi.AUTO.string("@|bold,fg(yellow) CODEFORGE v1.0.0|@"));
        out().println("──────────────────────────────────");
    }

    public static void info(String message) {
        out().println(CommandLine.Help.Ansi.AUTO.string("@|fg(cyan) [CODEFORGE]|@ " + message));
    }

    public static void success(String message) {
        out().println(CommandLine.Help.Ansi.AUTO.string("@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        out().println(CommandLine.Help.Ansi.AUTO.string("@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        out().println(CommandLine.Help.Ansi.AUTO.string("@|fg(red) x|@ " + message));
    }

    public static void task(String taskId, String filePath, TaskStatus status) {
        String colour = switch (status) {
            case DONE        -> "green";
            case FAILED      -> "red";
            case IN_PROGRESS -> "yellow";
            case PENDING     -> "white";
        };
        out().println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(" + colour + ") " + String.format("%-11s", status.name().toLowerCase()) + "|@ "
                        + taskId + "  " + filePath));
    }
}

package com.proofline.dispatch.cli;

import com.proofline.core.engine.RunResult;
import com.proofline.core.lifecycle.ProgressSummary;
import com.proofline.core.model.Task;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Proofline CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) PROOFLINE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PROOFLINE]|@ " + message));
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

    public static void runResult(RunResult result) {
        switch (result.outcome()) {
            case IDLE -> info(result.message());
            case COMPLETED -> success(result.message());
            case FAILED, UNREACHABLE -> error(result.message());
        }
        ProgressSummary progress = result.progress();
        if (progress != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  pending @|bold " + progress.pending() + "|@, changed @|fg(green) " + progress.changed()
                            + "|@, unchanged " + progress.unchanged()
                            + " | sync " + progress.syncProgress() + "%, ai " + progress.aiProgress() + "%"));
        }
    }

    public static void taskTableHeader() {
        System.out.printf("  %-6s %-8s %-8s %-24s %10s %10s %8s %8s%n",
                "TASK", "STAGE", "STATUS", "SOURCE", "FETCHED", "TOTAL", "SYNC%", "AI%");
        System.out.println("  " + "-".repeat(90));
    }

    public static void taskRow(Task task) {
        String line = String.format("  %-6d %-8s %-8s %-24s %10d %10d %8.2f %8.2f",
                task.id(), task.stage().dbValue(), task.status().dbValue(),
                truncate(task.tableName() + "." + task.columnName(), 24),
                task.recordsFetched(), task.recordsTotal(), task.syncProgress(), task.aiProgress());
        String color = switch (task.status()) {
            case ERROR -> "fg(red)";
            case RUNNING -> "fg(cyan)";
            case IDLE -> "fg(white)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|" + color + " " + line + "|@"));
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}

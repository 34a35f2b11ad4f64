package com.fleetwarden.dispatch.cli;

import com.fleetwarden.core.classifier.RecoveryAction;
import com.fleetwarden.core.classifier.RecoveryVerdict;
import com.fleetwarden.core.sync.ReconcileSummary;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output for the CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) FLEETWARDEN v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FLEETWARDEN]|@ " + message));
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

    public static void verdict(RecoveryVerdict verdict) {
        String color = switch (verdict.action()) {
            case BLOCK -> "fg(red)";
            case MANUAL -> "fg(magenta)";
            case COOLDOWN -> "fg(yellow)";
            case RETRY_WITH_PROMPT -> "fg(green)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold Action:|@ @|" + color + " " + verdict.action().wireName() + "|@"
                        + " (error #" + verdict.errorCount() + ")"));
        System.out.println("  Reason: " + verdict.reason());
        if (verdict.action() == RecoveryAction.COOLDOWN && verdict.cooldownMs() != null) {
            System.out.println("  Wait:   " + formatDuration(verdict.cooldownMs()));
        }
        if (verdict.prompt() != null) {
            System.out.println();
            System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|bold Recovery prompt|@"));
            verdict.prompt().lines().forEach(line -> System.out.println("    " + line));
        }
    }

    public static void reconcileSummary(ReconcileSummary s) {
        String status = s.isOk() ? "@|fg(green) " + s.status() + "|@" : "@|fg(red) " + s.status() + "|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Sync|@ " + status + " in " + formatDuration(s.durationMs())));
        System.out.printf("  checked %d, imported %d, pulled %d, pushed %d%n",
                s.checked(), s.imported(), s.pulled(), s.pushed());
        System.out.printf("  board mismatches %d, closed %d, missing %d%n",
                s.projectMismatches(), s.closed(), s.missing());
        if (s.conflicts() > 0) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(yellow) ownership conflicts " + s.conflicts() + "|@"));
        }
        if (s.errors() > 0) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(red) errors " + s.errors() + "|@"));
        }
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        if (seconds < 3600) return (seconds / 60) + "m " + (seconds % 60) + "s";
        return (seconds / 3600) + "h " + ((seconds % 3600) / 60) + "m";
    }
}

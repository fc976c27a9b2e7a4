package com.repolens.dispatch.cli;

import com.repolens.core.model.BundleEntry;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the RepoLens CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) REPOLENS v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [REPOLENS]|@ " + message));
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

    public static void fileEntry(int rank, BundleEntry entry) {
        String score = String.format(Locale.ROOT, "%6.2f", entry.score());
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                String.format("  %2d. @|fg(green) %s|@ %s (%s, %d tokens)%s",
                        rank, score, entry.path(), entry.language().id(), entry.estimatedTokens(),
                        entry.truncated() ? " @|fg(yellow) [truncated]|@" : "")));
    }

    public static void reason(String reason) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "        @|faint -|@ " + reason));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}

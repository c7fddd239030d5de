package com.docmend.dispatch.cli;

import com.docmend.core.model.ApplyOutcome;
import com.docmend.core.model.Suggestion;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Docmend CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) DOCMEND v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [DOCMEND]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void suggestion(Suggestion s) {
        String location = s.filePath() == null ? "(no file)"
                : s.lineNumber() == null ? s.filePath() : s.filePath() + ":" + s.lineNumber();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold,fg(yellow) [" + s.id() + "]|@ @|fg(blue) " + location + "|@ " + s.section()));
        System.out.println("      " + s.suggestionText());
    }

    public static void outcome(ApplyOutcome outcome) {
        for (var applied : outcome.successes()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(green) ~|@ [" + applied.suggestionId() + "] " + applied.filePath()));
        }
        for (var failed : outcome.errors()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(red) x|@ [" + failed.suggestionId() + "] " + failed.error()));
        }
        for (String backup : outcome.backups()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(magenta) [BACKUP]|@ " + backup));
        }
        if (outcome.errors().isEmpty()) {
            success(outcome.message());
        } else {
            error(outcome.message());
        }
    }
}

package com.docmend.dispatch.cli;

import com.docmend.core.backup.BackupManager;
import com.docmend.core.model.BackupInfo;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: docmend backups
 * <p>
 * Lists backup files, newest first, as a table: Name | Size | Created.
 */
@Command(name = "backups", mixinStandardHelpOptions = true, description = "List backup files")
@Component
public class BackupsCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "20")
    private int limit;

    private final BackupManager backupManager;

    public BackupsCommand(BackupManager backupManager) {
        this.backupManager = backupManager;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<BackupInfo> backups = backupManager.listBackups();
        if (backups.isEmpty()) {
            ConsoleOutput.info("No backups found.");
            return;
        }

        List<BackupInfo> display = backups.size() > limit ? backups.subList(0, limit) : backups;

        ConsoleOutput.info("Backups (" + display.size() + " of " + backups.size() + "):");
        System.out.println();
        System.out.printf("  %-50s %10s %s%n", "NAME", "BYTES", "CREATED");
        System.out.println("  " + "-".repeat(86));
        for (BackupInfo backup : display) {
            System.out.printf("  %-50s %10d %s%n", truncate(backup.name(), 50), backup.size(), backup.created());
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}

package com.docmend.core.backup;

import com.docmend.core.model.BackupInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Owns the backup directory. Each apply call opens its own {@link BackupSession},
 * so de-duplication never leaks across calls.
 */
@Service
public class BackupManager {

    private static final Logger log = LoggerFactory.getLogger(BackupManager.class);

    private final Path backupDir;
    private final Clock clock;

    public BackupManager(BackupProperties properties) {
        this(Path.of(properties.getDir()).toAbsolutePath().normalize(), Clock.systemDefaultZone());
    }

    BackupManager(Path backupDir, Clock clock) {
        this.backupDir = backupDir;
        this.clock = clock;
    }

    public Path backupDir() {
        return backupDir;
    }

    /**
     * Opens a backup scope for one apply call.
     */
    public BackupSession openSession() {
        return new BackupSession(backupDir, clock);
    }

    /**
     * Lists backup files on disk, newest first.
     */
    public List<BackupInfo> listBackups() {
        if (!Files.isDirectory(backupDir)) {
            return List.of();
        }
        var backups = new ArrayList<BackupInfo>();
        try (var stream = Files.list(backupDir)) {
            for (Path path : stream.filter(Files::isRegularFile).toList()) {
                try {
                    var attrs = Files.readAttributes(path, BasicFileAttributes.class);
                    backups.add(new BackupInfo(
                            path.getFileName().toString(),
                            attrs.size(),
                            attrs.lastModifiedTime().toInstant().toString(),
                            path.toString()));
                } catch (IOException e) {
                    log.warn("Skipping unreadable backup {}: {}", path, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list backups in " + backupDir, e);
        }
        backups.sort(Comparator.comparing(BackupInfo::created).reversed()
                .thenComparing(BackupInfo::name));
        return backups;
    }
}

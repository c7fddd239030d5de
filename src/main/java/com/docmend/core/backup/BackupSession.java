package com.docmend.core.backup;

import com.docmend.core.model.BackupRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Backup scope for a single apply call. The first backup of a path wins; later
 * requests for the same path return the existing record without copying again.
 * <p>
 * Not thread-safe. One apply call owns one session.
 */
public class BackupSession {

    private static final Logger log = LoggerFactory.getLogger(BackupSession.class);

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");
    private static final int MAX_SUFFIX = 1000;

    private final Path backupDir;
    private final Clock clock;
    private final Map<Path, BackupRecord> records = new LinkedHashMap<>();

    BackupSession(Path backupDir, Clock clock) {
        this.backupDir = backupDir;
        this.clock = clock;
    }

    /**
     * Copies {@code source} verbatim into the backup directory, once per session.
     *
     * @throws BackupException if the source is missing or unreadable, or the copy fails
     */
    public BackupRecord backup(Path source) {
        Path key = source.toAbsolutePath().normalize();
        BackupRecord existing = records.get(key);
        if (existing != null) {
            return existing;
        }
        if (!Files.isRegularFile(key)) {
            throw new BackupException("source does not exist: " + key);
        }
        if (!Files.isReadable(key)) {
            throw new BackupException("source is not readable: " + key);
        }

        Instant now = clock.instant();
        try {
            Files.createDirectories(backupDir);
            Path target = copyToFreeName(key, now);
            var record = new BackupRecord(key, target, now);
            records.put(key, record);
            log.info("Backed up {} to {}", key, target);
            return record;
        } catch (IOException e) {
            throw new BackupException(e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Backup paths created in this session, in creation order.
     */
    public List<String> createdBackups() {
        var paths = new ArrayList<String>();
        for (BackupRecord record : records.values()) {
            paths.add(record.backupPath().toString());
        }
        return paths;
    }

    private Path copyToFreeName(Path source, Instant now) throws IOException {
        String fileName = source.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String ext = dot > 0 ? fileName.substring(dot) : "";
        String base = stem + "_" + STAMP.format(LocalDateTime.ofInstant(now, clock.getZone()))
                + "_" + String.format("%08x", source.toString().hashCode());

        for (int attempt = 0; attempt < MAX_SUFFIX; attempt++) {
            Path target = backupDir.resolve(attempt == 0 ? base + ext : base + "-" + attempt + ext);
            try {
                // no REPLACE_EXISTING: an existing name means another backup owns it
                return Files.copy(source, target);
            } catch (FileAlreadyExistsException e) {
                log.debug("Backup name {} taken, trying next suffix", target.getFileName());
            }
        }
        throw new IOException("no free backup name for " + base + ext);
    }
}

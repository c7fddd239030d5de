package com.docmend.core.apply;

import com.docmend.core.backup.BackupException;
import com.docmend.core.backup.BackupManager;
import com.docmend.core.backup.BackupSession;
import com.docmend.core.corpus.CorpusIndex;
import com.docmend.core.metrics.DocmendMetrics;
import com.docmend.core.model.ApplyOutcome;
import com.docmend.core.model.Suggestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes approved suggestions to the corpus.
 * <p>
 * Items are processed in order and independently: a failure is recorded against
 * its suggestion id and the batch continues. No file is written unless its backup
 * for this call succeeded, and every write replaces the whole file in one move.
 * <p>
 * Concurrent apply calls that target the same file are not coordinated; the last
 * writer wins. Callers that need stronger guarantees must serialise apply calls.
 */
@Service
public class ApplyEngine {

    private static final Logger log = LoggerFactory.getLogger(ApplyEngine.class);

    static final String NO_TARGET = "no target file associated with this suggestion";
    static final String NOT_FOUND = "file not found";
    static final String APPLIED = "Successfully applied";

    private final CorpusIndex corpusIndex;
    private final BackupManager backupManager;
    private final DocmendMetrics metrics;

    public ApplyEngine(CorpusIndex corpusIndex, BackupManager backupManager, DocmendMetrics metrics) {
        this.corpusIndex = corpusIndex;
        this.backupManager = backupManager;
        this.metrics = metrics;
    }

    /**
     * Applies each suggestion's text to its target file.
     *
     * @param suggestions approved or edited suggestions whose {@code suggestionText}
     *                    already holds the effective text
     * @return a fresh outcome listing per-item successes and errors and all backups taken
     */
    public ApplyOutcome apply(List<Suggestion> suggestions) {
        var successes = new ArrayList<ApplyOutcome.Applied>();
        var errors = new ArrayList<ApplyOutcome.Failed>();
        BackupSession backups = backupManager.openSession();

        for (Suggestion suggestion : suggestions) {
            try {
                String error = applyOne(suggestion, backups);
                if (error == null) {
                    successes.add(new ApplyOutcome.Applied(suggestion.id(), suggestion.filePath(), APPLIED));
                } else {
                    log.warn("Suggestion {} not applied: {}", suggestion.id(), error);
                    errors.add(new ApplyOutcome.Failed(suggestion.id(), error));
                }
            } catch (RuntimeException e) {
                log.error("Unexpected failure applying suggestion {}", suggestion.id(), e);
                errors.add(new ApplyOutcome.Failed(suggestion.id(),
                        e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
            }
        }

        var outcome = new ApplyOutcome(successes, errors, backups.createdBackups());
        metrics.recordApplyResult(successes.size(), errors.size());
        metrics.recordBackupsCreated(outcome.backups().size());
        log.info("Apply finished: {} applied, {} failed, {} backups", successes.size(), errors.size(),
                outcome.backups().size());
        return outcome;
    }

    /**
     * Returns {@code null} on success, otherwise the error message to record.
     */
    private String applyOne(Suggestion suggestion, BackupSession backups) {
        if (suggestion.filePath() == null || suggestion.filePath().isBlank()) {
            return NO_TARGET;
        }
        var resolved = corpusIndex.resolve(suggestion.filePath());
        if (resolved.isEmpty()) {
            return NOT_FOUND;
        }
        Path file = resolved.get();

        try {
            backups.backup(file);
        } catch (BackupException e) {
            return "backup failed: " + e.getMessage();
        }

        String text = suggestion.suggestionText() != null ? suggestion.suggestionText() : "";
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            String updated = TextEdits.isAnchored(content, suggestion.lineNumber())
                    ? TextEdits.replaceLine(content, suggestion.lineNumber(), text)
                    : TextEdits.append(content, text);
            writeWhole(file, updated);
            log.debug("Applied suggestion {} to {}", suggestion.id(), suggestion.filePath());
            return null;
        } catch (IOException e) {
            return "write failed: " + e.getClass().getSimpleName() + ": " + e.getMessage();
        }
    }

    private static void writeWhole(Path file, String content) throws IOException {
        Path temp = Files.createTempFile(file.getParent(), "." + file.getFileName(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}

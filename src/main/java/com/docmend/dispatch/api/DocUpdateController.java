package com.docmend.dispatch.api;

import com.docmend.core.apply.ApplyEngine;
import com.docmend.core.backup.BackupManager;
import com.docmend.core.corpus.CorpusIndex;
import com.docmend.core.model.ApplyOutcome;
import com.docmend.core.model.BackupInfo;
import com.docmend.core.model.DocumentFile;
import com.docmend.core.model.Suggestion;
import com.docmend.core.suggest.InvalidInputException;
import com.docmend.core.suggest.SuggestionGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for the suggest / apply round trip and read-only corpus listings.
 */
@RestController
@RequestMapping("/api/v1/doc-updates")
public class DocUpdateController {

    private static final Logger log = LoggerFactory.getLogger(DocUpdateController.class);

    private final SuggestionGenerator suggestionGenerator;
    private final ApplyEngine applyEngine;
    private final CorpusIndex corpusIndex;
    private final BackupManager backupManager;

    public DocUpdateController(SuggestionGenerator suggestionGenerator,
                               ApplyEngine applyEngine,
                               CorpusIndex corpusIndex,
                               BackupManager backupManager) {
        this.suggestionGenerator = suggestionGenerator;
        this.applyEngine = applyEngine;
        this.corpusIndex = corpusIndex;
        this.backupManager = backupManager;
    }

    /**
     * POST /api/v1/doc-updates/suggest — Generate suggestions for a query.
     * AI unavailability degrades to keyword suggestions and never fails the request.
     */
    @PostMapping("/suggest")
    public ResponseEntity<?> suggest(@RequestBody SuggestRequest request) {
        try {
            List<Suggestion> suggestions = suggestionGenerator.generate(request.query());
            return ResponseEntity.ok(new SuggestResponse(suggestions,
                    suggestions.isEmpty() ? "No matching documentation found"
                            : "Suggestions generated successfully"));
        } catch (InvalidInputException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Suggestion generation failed", e);
            return internalError("Error generating suggestions", e);
        }
    }

    /**
     * POST /api/v1/doc-updates/apply — Apply approved suggestions. Per-item failures
     * are reported in the body; the call itself succeeds.
     */
    @PostMapping("/apply")
    public ResponseEntity<?> apply(@RequestBody ApplyRequest request) {
        if (request.suggestions() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "suggestions list is required"));
        }
        try {
            ApplyOutcome outcome = applyEngine.apply(request.suggestions());
            return ResponseEntity.ok(outcome);
        } catch (Exception e) {
            log.error("Apply failed", e);
            return internalError("Error applying updates", e);
        }
    }

    /**
     * GET /api/v1/doc-updates/files — List corpus documents with their sections.
     */
    @GetMapping("/files")
    public ResponseEntity<?> listFiles() {
        try {
            List<DocumentFile> files = corpusIndex.listFiles();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("files", files);
            body.put("count", files.size());
            return ResponseEntity.ok(body);
        } catch (Exception e) {
            log.error("Listing files failed", e);
            return internalError("Error listing files", e);
        }
    }

    /**
     * GET /api/v1/doc-updates/files/content?path=... — Raw content of one document.
     */
    @GetMapping("/files/content")
    public ResponseEntity<Map<String, Object>> fileContent(@RequestParam("path") String path) {
        return corpusIndex.load(path)
                .<ResponseEntity<Map<String, Object>>>map(file -> ResponseEntity.ok(Map.of(
                        "path", file.path(),
                        "content", file.content())))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "File not found: " + path)));
    }

    /**
     * GET /api/v1/doc-updates/backups — List backup files, newest first.
     */
    @GetMapping("/backups")
    public ResponseEntity<?> listBackups() {
        try {
            List<BackupInfo> backups = backupManager.listBackups();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("backups", backups);
            body.put("count", backups.size());
            return ResponseEntity.ok(body);
        } catch (Exception e) {
            log.error("Listing backups failed", e);
            return internalError("Error listing backups", e);
        }
    }

    static ResponseEntity<Map<String, String>> internalError(String prefix, Exception e) {
        String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", prefix + ": " + detail));
    }
}

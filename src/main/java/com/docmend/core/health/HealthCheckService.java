package com.docmend.core.health;

import com.docmend.core.backup.BackupManager;
import com.docmend.core.corpus.CorpusIndex;
import com.docmend.core.llm.LlmService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final CorpusIndex corpusIndex;
    private final BackupManager backupManager;
    private final LlmService llmService;

    public HealthCheckService(CorpusIndex corpusIndex, BackupManager backupManager, LlmService llmService) {
        this.corpusIndex = corpusIndex;
        this.backupManager = backupManager;
        this.llmService = llmService;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkCorpus());
        results.add(checkBackups());
        results.add(checkLlm());
        return results;
    }

    private HealthStatus checkCorpus() {
        Path root = corpusIndex.root();
        if (!Files.isDirectory(root) || !Files.isReadable(root)) {
            return new HealthStatus("corpus", HealthStatus.Status.DOWN,
                    "Corpus root not readable: " + root, Map.of("root", root.toString()));
        }
        try {
            int count = corpusIndex.listFiles().size();
            return new HealthStatus("corpus", HealthStatus.Status.UP,
                    count + " document(s) under " + root, Map.of("root", root.toString()));
        } catch (Exception e) {
            log.warn("Corpus health check failed: {}", e.getMessage());
            return new HealthStatus("corpus", HealthStatus.Status.DOWN,
                    "Corpus error: " + e.getMessage(), Map.of("root", root.toString()));
        }
    }

    private HealthStatus checkBackups() {
        Path dir = backupManager.backupDir();
        if (Files.isDirectory(dir)) {
            return Files.isWritable(dir)
                    ? new HealthStatus("backups", HealthStatus.Status.UP,
                            "Backup directory writable", Map.of("dir", dir.toString()))
                    : new HealthStatus("backups", HealthStatus.Status.DOWN,
                            "Backup directory not writable", Map.of("dir", dir.toString()));
        }
        // Created on first backup; the nearest existing ancestor must accept it
        Path parent = dir.toAbsolutePath().getParent();
        while (parent != null && !Files.exists(parent)) {
            parent = parent.getParent();
        }
        if (parent != null && Files.isWritable(parent)) {
            return new HealthStatus("backups", HealthStatus.Status.UP,
                    "Backup directory will be created on first apply", Map.of("dir", dir.toString()));
        }
        return new HealthStatus("backups", HealthStatus.Status.DOWN,
                "Backup directory cannot be created", Map.of("dir", dir.toString()));
    }

    private HealthStatus checkLlm() {
        if (llmService.isAvailable()) {
            return new HealthStatus("llm", HealthStatus.Status.UP,
                    "Chat model configured", Map.of());
        }
        return new HealthStatus("llm", HealthStatus.Status.DEGRADED,
                "No chat model enabled; keyword suggestions only", Map.of());
    }
}

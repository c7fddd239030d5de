package com.docmend.core.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A verbatim copy of a corpus file taken before it was modified.
 */
public record BackupRecord(
    Path originalPath,
    Path backupPath,
    Instant timestamp
) {}
